package com.bko.ensemble.stream;

import java.time.Instant;

/**
 * One buffered event of a run. {@code id} increases by one per event within a run and is what clients pass
 * back as {@code since} on reconnect.
 */
public record StreamEvent(
        long id,
        String runId,
        String mode,
        Instant timestamp,
        String type,
        Object data
) {
}
