package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.UsageCarrier;
import com.bko.ensemble.orchestration.support.TranscriptEntry;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code positions} maps instance id to {@code pro} or {@code con}. {@code currentRoundTurns} only holds turns
 * of {@code currentRound}.
 */
@With
@JsonTypeName("debated")
public record DebatedState(
        Phase phase,
        int currentRound,
        int totalRounds,
        Map<String, String> positions,
        List<DebateTurn> turns,
        List<DebateTurn> currentRoundTurns,
        String summarizerModel,
        String summarizerInstanceId,
        @Nullable String summary,
        @Nullable MessageUsage summaryUsage
) implements ModeState {

    public DebatedState {
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        turns = List.copyOf(turns);
        currentRoundTurns = List.copyOf(currentRoundTurns);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.DEBATED;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public DebatedState withTurn(DebateTurn turn) {
        List<DebateTurn> roundTurns = turn.round() == currentRound
                ? StateLists.append(currentRoundTurns, turn)
                : List.of(turn);
        return withTurns(StateLists.append(turns, turn)).withCurrentRoundTurns(roundTurns);
    }

    public DebatedState startRound(Phase nextPhase, int round) {
        return withPhase(nextPhase).withCurrentRound(round).withCurrentRoundTurns(List.of());
    }

    public record DebateTurn(
            String instanceId,
            String model,
            String position,
            String content,
            int round,
            @Nullable MessageUsage usage
    ) implements TranscriptEntry, UsageCarrier {
    }

    public enum Phase {
        OPENING, DEBATING, SUMMARIZING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
