package com.bko.ensemble.orchestration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Arrays;

public enum ConversationMode {
    MULTIPLE("multiple", "Parallel answers"),
    SYNTHESIZED("synthesized", "Synthesized"),
    CONFIDENCE_WEIGHTED("confidence-weighted", "Confidence-weighted synthesis"),
    ROUTED("routed", "Routed"),
    ELECTED("elected", "Elected by vote"),
    CONSENSUS("consensus", "Consensus"),
    DEBATED("debated", "Debate"),
    COUNCIL("council", "Council"),
    CRITIQUED("critiqued", "Critique and revise"),
    HIERARCHICAL("hierarchical", "Hierarchical decomposition"),
    TOURNAMENT("tournament", "Tournament"),
    EXPLAINER("explainer", "Multi-audience explainer"),
    SCATTERSHOT("scattershot", "Parameter scattershot");

    private final String id;
    private final String label;

    ConversationMode(String id, String label) {
        this.id = id;
        this.label = label;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    @JsonCreator
    @Nullable
    public static ConversationMode fromId(@Nullable String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(mode -> mode.id.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown conversation mode: " + value));
    }
}
