package com.bko.ensemble.orchestration.model;

import org.springframework.lang.Nullable;

public interface UsageCarrier {

    @Nullable
    MessageUsage usage();
}
