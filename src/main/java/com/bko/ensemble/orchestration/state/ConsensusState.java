package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

@With
@JsonTypeName("consensus")
public record ConsensusState(
        Phase phase,
        int currentRound,
        int maxRounds,
        double threshold,
        List<ConsensusRound> rounds,
        List<CandidateResponse> currentRoundResponses,
        @Nullable Double finalScore,
        boolean consensusReached,
        @Nullable CandidateResponse representative
) implements ModeState {

    public ConsensusState {
        rounds = List.copyOf(rounds);
        currentRoundResponses = List.copyOf(currentRoundResponses);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.CONSENSUS;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public ConsensusState withRoundResponse(CandidateResponse response) {
        return withCurrentRoundResponses(StateLists.append(currentRoundResponses, response));
    }

    public ConsensusState withRound(ConsensusRound round) {
        return withRounds(StateLists.append(rounds, round));
    }

    /** Round 0 holds the unrevised answers and is never scored. */
    public record ConsensusRound(
            int round,
            List<CandidateResponse> responses,
            boolean consensusReached,
            @Nullable Double consensusScore
    ) {

        public ConsensusRound {
            responses = List.copyOf(responses);
        }
    }

    public enum Phase {
        RESPONDING, REVISING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
