package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.state.ModeState;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Keeps the most recent state of a run so callers can report it once the run is over.
 */
public class LatestStatePublisher implements ModeStatePublisher {

    private final AtomicReference<ModeState> latest = new AtomicReference<>();

    @Override
    public void initStreaming(List<String> streamIds, Map<String, String> modelsByStreamId) {
    }

    @Override
    public void setModeState(ModeState state) {
        latest.set(state);
        onState(state);
    }

    @Override
    public void updateModeState(UnaryOperator<ModeState> updater) {
        ModeState next = latest.updateAndGet(current -> current == null ? null : updater.apply(current));
        if (next != null) {
            onState(next);
        }
    }

    @Nullable
    public ModeState latest() {
        return latest.get();
    }

    protected void onState(ModeState state) {
    }
}
