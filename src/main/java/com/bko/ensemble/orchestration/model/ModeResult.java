package com.bko.ensemble.orchestration.model;

import org.springframework.lang.Nullable;

public record ModeResult(
        String content,
        @Nullable MessageUsage usage,
        @Nullable ModeMetadata metadata
) implements UsageCarrier {
}
