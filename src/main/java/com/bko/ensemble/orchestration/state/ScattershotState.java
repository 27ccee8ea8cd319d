package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.ModelParameters;
import com.bko.ensemble.orchestration.model.UsageCarrier;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

@With
@JsonTypeName("scattershot")
public record ScattershotState(
        Phase phase,
        String targetModel,
        String targetInstanceId,
        List<Variation> variations
) implements ModeState {

    public ScattershotState {
        variations = List.copyOf(variations);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.SCATTERSHOT;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public ScattershotState withVariation(Variation updated) {
        return withVariations(variations.stream()
                .map(variation -> variation.id().equals(updated.id()) ? updated : variation)
                .toList());
    }

    @With
    public record Variation(
            String id,
            int index,
            ModelParameters params,
            String label,
            Status status,
            @Nullable String content,
            @Nullable MessageUsage usage
    ) implements UsageCarrier {

        public enum Status {
            PENDING, GENERATING, COMPLETE, FAILED;

            @JsonValue
            public String value() {
                return name().toLowerCase(Locale.ROOT);
            }
        }
    }

    public enum Phase {
        GENERATING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
