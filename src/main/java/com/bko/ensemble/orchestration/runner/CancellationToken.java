package com.bko.ensemble.orchestration.runner;

import java.util.concurrent.Future;

public final class CancellationToken {

    private volatile boolean cancelled;
    private volatile Future<?> call;

    CancellationToken() {
    }

    void bind(Future<?> future) {
        this.call = future;
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void cancel() {
        cancelled = true;
        Future<?> current = call;
        if (current != null) {
            current.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
