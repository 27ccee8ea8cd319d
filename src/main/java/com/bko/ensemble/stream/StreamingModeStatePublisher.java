package com.bko.ensemble.stream;

import com.bko.ensemble.orchestration.runner.LatestStatePublisher;
import com.bko.ensemble.orchestration.state.ModeState;

import java.util.List;
import java.util.Map;

/**
 * Publishes one run's state changes and stream announcements as WebSocket events.
 */
public class StreamingModeStatePublisher extends LatestStatePublisher {

    private final ModeStreamService streamService;
    private final String runId;

    public StreamingModeStatePublisher(ModeStreamService streamService, String runId) {
        this.streamService = streamService;
        this.runId = runId;
    }

    @Override
    public void initStreaming(List<String> streamIds, Map<String, String> modelsByStreamId) {
        streamService.emitStreamInit(runId, streamIds, modelsByStreamId);
    }

    @Override
    protected void onState(ModeState state) {
        streamService.emitModeState(runId, state);
    }
}
