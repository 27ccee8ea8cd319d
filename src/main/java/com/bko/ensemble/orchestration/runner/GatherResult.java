package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.StreamResult;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one fan-out. {@code orderedResults} is positional over the calls passed in and holds
 * {@code null} for every failed call; {@code successes} lists the successful calls in completion order.
 */
public record GatherResult(
        List<InstanceCall> calls,
        List<StreamResult> orderedResults,
        List<InstanceSuccess> successes
) {

    public GatherResult {
        calls = List.copyOf(calls);
        orderedResults = Collections.unmodifiableList(orderedResults);
        successes = List.copyOf(successes);
    }

    public int successCount() {
        return successes.size();
    }

    @Nullable
    public StreamResult resultAt(int index) {
        return orderedResults.get(index);
    }
}
