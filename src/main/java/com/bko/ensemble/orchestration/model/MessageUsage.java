package com.bko.ensemble.orchestration.model;

import org.springframework.lang.Nullable;

public record MessageUsage(
        long inputTokens,
        long outputTokens,
        long totalTokens,
        double cost
) {

    public static final MessageUsage ZERO = new MessageUsage(0, 0, 0, 0);

    public MessageUsage plus(@Nullable MessageUsage other) {
        if (other == null) {
            return this;
        }
        return new MessageUsage(
                inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                totalTokens + other.totalTokens,
                cost + other.cost);
    }
}
