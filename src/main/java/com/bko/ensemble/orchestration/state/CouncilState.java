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

@With
@JsonTypeName("council")
public record CouncilState(
        Phase phase,
        int currentRound,
        int totalRounds,
        Map<String, String> roles,
        List<CouncilStatement> statements,
        List<CouncilStatement> currentRoundStatements,
        String synthesizerModel,
        String synthesizerInstanceId,
        @Nullable String synthesis,
        @Nullable MessageUsage synthesisUsage,
        @Nullable MessageUsage roleAssignmentUsage
) implements ModeState {

    public CouncilState {
        roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        statements = List.copyOf(statements);
        currentRoundStatements = List.copyOf(currentRoundStatements);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.COUNCIL;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public CouncilState withStatement(CouncilStatement statement) {
        List<CouncilStatement> roundStatements = statement.round() == currentRound
                ? StateLists.append(currentRoundStatements, statement)
                : List.of(statement);
        return withStatements(StateLists.append(statements, statement)).withCurrentRoundStatements(roundStatements);
    }

    public CouncilState startRound(Phase nextPhase, int round) {
        return withPhase(nextPhase).withCurrentRound(round).withCurrentRoundStatements(List.of());
    }

    public record CouncilStatement(
            String instanceId,
            String model,
            String role,
            String content,
            int round,
            @Nullable MessageUsage usage
    ) implements TranscriptEntry, UsageCarrier {
    }

    public enum Phase {
        ASSIGNING, OPENING, DISCUSSING, SYNTHESIZING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
