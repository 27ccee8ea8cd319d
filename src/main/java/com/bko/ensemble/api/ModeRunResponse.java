package com.bko.ensemble.api;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModeRunOutcome;
import com.bko.ensemble.orchestration.state.ModeState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ModeRunResponse(
        String requestId,
        Instant createdAt,
        ConversationMode mode,
        List<ModeResult> results,
        ModeState finalState
) {

    public static ModeRunResponse from(ModeRunOutcome outcome) {
        return new ModeRunResponse(UUID.randomUUID().toString(), Instant.now(), outcome.mode(),
                outcome.results(), outcome.finalState());
    }
}
