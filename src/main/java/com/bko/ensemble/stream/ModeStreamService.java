package com.bko.ensemble.stream;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.state.ModeState;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class ModeStreamService {
    static final int CHUNK_SIZE = 600;

    private final ModeStreamHub hub;

    public ModeStreamService(ModeStreamHub hub) {
        this.hub = hub;
    }

    public String createRun(ConversationMode mode) {
        return hub.createRun(mode);
    }

    public boolean cancelRun(String runId) {
        return hub.cancelRun(runId);
    }

    public boolean isCancelled(String runId) {
        return hub.isCancelled(runId);
    }

    public void emitStatus(String runId, String message) {
        hub.emit(runId, StreamEventType.STATUS, Map.of("message", message));
    }

    public void emitStreamInit(String runId, List<String> streamIds, Map<String, String> modelsByStreamId) {
        hub.emit(runId, StreamEventType.STREAM_INIT, Map.of(
                "streamIds", List.copyOf(streamIds),
                "models", Map.copyOf(modelsByStreamId)
        ));
    }

    public void emitModeState(String runId, ModeState state) {
        hub.emit(runId, StreamEventType.MODE_STATE, state);
    }

    /**
     * Sends a finished call's content as a numbered sequence of chunks. An empty or failed call still gets a
     * single {@code done} chunk so clients can close the stream.
     */
    public void emitInstanceOutput(String runId, String streamId, String modelId, @Nullable String content) {
        if (!StringUtils.hasText(content)) {
            Map<String, Object> payload = chunkPayload(streamId, modelId, "", 0, true);
            payload.put("failed", content == null);
            hub.emit(runId, StreamEventType.INSTANCE_OUTPUT, payload);
            return;
        }
        int sequence = 0;
        for (int index = 0; index < content.length(); index += CHUNK_SIZE) {
            int end = Math.min(content.length(), index + CHUNK_SIZE);
            hub.emit(runId, StreamEventType.INSTANCE_OUTPUT,
                    chunkPayload(streamId, modelId, content.substring(index, end), sequence++, end >= content.length()));
        }
    }

    public void emitResults(String runId, List<ModeResult> results) {
        // positional lists may hold nulls, which Map.of rejects
        Map<String, Object> payload = new HashMap<>();
        payload.put("results", new ArrayList<>(results));
        hub.emit(runId, StreamEventType.RESULT, payload);
    }

    public void emitRunComplete(String runId, String status) {
        hub.emit(runId, StreamEventType.RUN_COMPLETE, Map.of("status", status));
    }

    public void emitError(String runId, String message) {
        hub.emit(runId, StreamEventType.ERROR, Map.of("message", message == null ? "Unknown error" : message));
    }

    private Map<String, Object> chunkPayload(String streamId, String modelId, String chunk, int sequence,
                                             boolean done) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("streamId", streamId);
        payload.put("model", modelId);
        payload.put("chunk", chunk);
        payload.put("sequence", sequence);
        payload.put("done", done);
        return payload;
    }
}
