package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.UsageCarrier;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

@With
@JsonTypeName("explainer")
public record ExplainerState(
        Phase phase,
        List<String> audienceLevels,
        int currentLevelIndex,
        List<Explanation> explanations,
        @Nullable String currentModel
) implements ModeState {

    public ExplainerState {
        audienceLevels = List.copyOf(audienceLevels);
        explanations = List.copyOf(explanations);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.EXPLAINER;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public ExplainerState withExplanation(Explanation explanation) {
        return withExplanations(StateLists.append(explanations, explanation));
    }

    public record Explanation(
            String level,
            String instanceId,
            String model,
            @Nullable String instanceLabel,
            String content,
            @Nullable MessageUsage usage
    ) implements UsageCarrier {
    }

    public enum Phase {
        INITIAL, SIMPLIFYING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
