package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

@With
@JsonTypeName("critiqued")
public record CritiquedState(
        Phase phase,
        String primaryModel,
        String primaryInstanceId,
        List<String> critiqueModels,
        @Nullable String initialResponse,
        @Nullable MessageUsage initialUsage,
        List<CandidateResponse> critiques,
        @Nullable StreamResult revision
) implements ModeState {

    public CritiquedState {
        critiqueModels = List.copyOf(critiqueModels);
        critiques = List.copyOf(critiques);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.CRITIQUED;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public CritiquedState withCritique(CandidateResponse critique) {
        return withCritiques(StateLists.append(critiques, critique));
    }

    public enum Phase {
        INITIAL, CRITIQUING, REVISING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
