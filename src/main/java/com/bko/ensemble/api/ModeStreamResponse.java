package com.bko.ensemble.api;

import java.time.Instant;

public record ModeStreamResponse(
        String runId,
        Instant createdAt
) {
}
