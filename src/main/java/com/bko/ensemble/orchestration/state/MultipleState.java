package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;

import java.util.List;
import java.util.Locale;

@With
@JsonTypeName("multiple")
public record MultipleState(Phase phase, List<CandidateResponse> responses) implements ModeState {

    public MultipleState {
        responses = List.copyOf(responses);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.MULTIPLE;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public MultipleState withResponse(CandidateResponse response) {
        return new MultipleState(phase, StateLists.append(responses, response));
    }

    public enum Phase {
        RESPONDING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
