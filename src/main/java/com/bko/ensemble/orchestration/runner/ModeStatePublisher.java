package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.state.ModeState;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

public interface ModeStatePublisher {

    ModeStatePublisher NOOP = new ModeStatePublisher() {
        @Override
        public void initStreaming(List<String> streamIds, Map<String, String> modelsByStreamId) {
        }

        @Override
        public void setModeState(ModeState state) {
        }

        @Override
        public void updateModeState(UnaryOperator<ModeState> updater) {
        }
    };

    /** Announces the identities about to stream in the next round. */
    void initStreaming(List<String> streamIds, Map<String, String> modelsByStreamId);

    void setModeState(ModeState state);

    void updateModeState(UnaryOperator<ModeState> updater);
}
