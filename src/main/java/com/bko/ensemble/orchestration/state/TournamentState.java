package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Competitors, judges and winners are referenced by instance id. {@code bracket.get(0)} is the full field.
 */
@With
@JsonTypeName("tournament")
public record TournamentState(
        Phase phase,
        List<List<String>> bracket,
        int currentRound,
        int totalRounds,
        List<TournamentMatch> matches,
        List<CandidateResponse> initialResponses,
        List<List<String>> eliminatedPerRound,
        @Nullable String winner,
        @Nullable String winnerInstanceId
) implements ModeState {

    public TournamentState {
        bracket = bracket.stream().map(List::copyOf).toList();
        matches = List.copyOf(matches);
        initialResponses = List.copyOf(initialResponses);
        eliminatedPerRound = eliminatedPerRound.stream().map(List::copyOf).toList();
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.TOURNAMENT;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public TournamentState withInitialResponse(CandidateResponse response) {
        return withInitialResponses(StateLists.append(initialResponses, response));
    }

    public TournamentState withMatch(TournamentMatch match) {
        return withMatches(StateLists.append(matches, match));
    }

    public TournamentState withCompletedMatch(TournamentMatch completed) {
        return withMatches(matches.stream()
                .map(match -> match.id().equals(completed.id()) ? completed : match)
                .toList());
    }

    @With
    public record TournamentMatch(
            String id,
            int round,
            String competitor1,
            String competitor2,
            String judge,
            @Nullable String winner,
            Status status,
            @Nullable String reasoning,
            @Nullable MessageUsage judgeUsage
    ) {

        public enum Status {
            JUDGING, COMPLETE;

            @JsonValue
            public String value() {
                return name().toLowerCase(Locale.ROOT);
            }
        }
    }

    public enum Phase {
        GENERATING, COMPETING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
