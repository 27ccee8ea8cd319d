package com.bko.ensemble.orchestration.model;

import org.springframework.lang.Nullable;

public record StreamResult(String content, @Nullable MessageUsage usage) implements UsageCarrier {

    public static StreamResult of(String content) {
        return new StreamResult(content, null);
    }
}
