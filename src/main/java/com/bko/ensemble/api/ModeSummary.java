package com.bko.ensemble.api;

import com.bko.ensemble.orchestration.runner.ModeSpec;

public record ModeSummary(
        String id,
        String label,
        int minInstances
) {

    public static ModeSummary from(ModeSpec<?> spec) {
        return new ModeSummary(spec.mode().id(), spec.mode().label(), spec.minInstances());
    }
}
