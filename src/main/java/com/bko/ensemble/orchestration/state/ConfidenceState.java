package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.model.UsageCarrier;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

@With
@JsonTypeName("confidence-weighted")
public record ConfidenceState(
        Phase phase,
        String synthesizerModel,
        String synthesizerInstanceId,
        List<ConfidenceResponse> responses,
        int totalModels,
        @Nullable StreamResult synthesis
) implements ModeState {

    public ConfidenceState {
        responses = List.copyOf(responses);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.CONFIDENCE_WEIGHTED;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public ConfidenceState withResponse(ConfidenceResponse response) {
        return withResponses(StateLists.append(responses, response));
    }

    /** An answer with its self-reported confidence in {@code [0, 1]}; the trailer is already stripped. */
    public record ConfidenceResponse(
            String instanceId,
            String model,
            String content,
            double confidence,
            @Nullable MessageUsage usage
    ) implements UsageCarrier {
    }

    public enum Phase {
        GATHERING, SYNTHESIZING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
