package com.bko.ensemble.orchestration.model;

import com.bko.ensemble.orchestration.state.ModeState;
import org.springframework.lang.Nullable;

public record ModeMetadata(
        ConversationMode mode,
        ResultKind kind,
        @Nullable String label,
        @Nullable ModeState state,
        @Nullable MessageUsage aggregateUsage
) {

    public static ModeMetadata of(ConversationMode mode, ResultKind kind, ModeState state,
                                  @Nullable MessageUsage aggregateUsage) {
        return new ModeMetadata(mode, kind, null, state, aggregateUsage);
    }
}
