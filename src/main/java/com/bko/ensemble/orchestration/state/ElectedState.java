package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.UsageCarrier;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@With
@JsonTypeName("elected")
public record ElectedState(
        Phase phase,
        List<CandidateResponse> candidates,
        List<Vote> votes,
        @Nullable String winner,
        @Nullable String winnerInstanceId,
        Map<String, Integer> voteCounts
) implements ModeState {

    public ElectedState {
        candidates = List.copyOf(candidates);
        votes = List.copyOf(votes);
        voteCounts = Collections.unmodifiableMap(new LinkedHashMap<>(voteCounts));
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.ELECTED;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public ElectedState withCandidate(CandidateResponse candidate) {
        return withCandidates(StateLists.append(candidates, candidate));
    }

    public ElectedState withVote(Vote vote) {
        return withVotes(StateLists.append(votes, vote));
    }

    /**
     * @param votedFor display name of the chosen candidate, or {@code null} when the ballot was unreadable
     */
    public record Vote(
            String voterInstanceId,
            String voter,
            @Nullable String votedFor,
            String reasoning,
            @Nullable MessageUsage usage
    ) implements UsageCarrier {
    }

    public enum Phase {
        RESPONDING, VOTING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
