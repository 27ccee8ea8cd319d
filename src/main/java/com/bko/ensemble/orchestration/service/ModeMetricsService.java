package com.bko.ensemble.orchestration.service;

import com.bko.ensemble.orchestration.model.ConversationMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ModeMetricsService {

    private final AtomicLong callCount = new AtomicLong();
    private final AtomicLong failedCallCount = new AtomicLong();
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong fallbackCount = new AtomicLong();

    public void recordCall(String modelId, @Nullable String streamId) {
        long count = callCount.incrementAndGet();
        if (StringUtils.hasText(streamId) && !streamId.equals(modelId)) {
            log.debug("Model call #{} issued (model={}, stream={}).", count, modelId, streamId);
        } else {
            log.debug("Model call #{} issued (model={}).", count, modelId);
        }
    }

    public void recordFailedCall(String modelId) {
        long failed = failedCallCount.incrementAndGet();
        log.info("Model call to {} produced no output. Total failed calls={}.", modelId, failed);
    }

    public void recordRun(ConversationMode mode, int instanceCount) {
        long count = runCount.incrementAndGet();
        log.info("Mode run #{} started (mode={}, instances={}).", count, mode.id(), instanceCount);
    }

    public void recordFallback(ConversationMode mode, int instanceCount) {
        long count = fallbackCount.incrementAndGet();
        log.info("Mode {} not applicable to {} instances, using fallback. Total fallbacks={}.",
                mode.id(), instanceCount, count);
    }

    public long callCount() {
        return callCount.get();
    }

    public long failedCallCount() {
        return failedCallCount.get();
    }

    public long runCount() {
        return runCount.get();
    }

    public long fallbackCount() {
        return fallbackCount.get();
    }

    public void logSummary() {
        log.info("Mode stats: totalRuns={}, totalFallbacks={}, totalCalls={}, failedCalls={}.",
                runCount.get(), fallbackCount.get(), callCount.get(), failedCallCount.get());
    }
}
