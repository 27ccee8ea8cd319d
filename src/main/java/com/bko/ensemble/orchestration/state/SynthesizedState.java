package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

@With
@JsonTypeName("synthesized")
public record SynthesizedState(
        Phase phase,
        String synthesizerModel,
        String synthesizerInstanceId,
        List<CandidateResponse> sourceResponses,
        int completedResponses,
        int totalModels,
        @Nullable StreamResult synthesis
) implements ModeState {

    public SynthesizedState {
        sourceResponses = List.copyOf(sourceResponses);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.SYNTHESIZED;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public SynthesizedState withResponse(CandidateResponse response) {
        return new SynthesizedState(phase, synthesizerModel, synthesizerInstanceId,
                StateLists.append(sourceResponses, response),
                completedResponses + 1, totalModels, synthesis);
    }

    public enum Phase {
        GATHERING, SYNTHESIZING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
