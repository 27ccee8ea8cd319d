package com.bko.ensemble.orchestration.model;

import com.bko.ensemble.orchestration.state.ModeState;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * {@code finalState} is {@code null} when the run never got past eligibility and no fallback published state.
 */
public record ModeRunOutcome(
        ConversationMode mode,
        List<ModeResult> results,
        @Nullable ModeState finalState
) {
}
