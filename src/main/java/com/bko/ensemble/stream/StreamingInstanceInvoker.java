package com.bko.ensemble.stream;

import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.InstanceInvoker;
import com.bko.ensemble.orchestration.runner.InvocationRequest;
import org.springframework.lang.Nullable;

/**
 * Forwards each finished call's output to the run's stream, keyed by the call's stream id.
 */
public class StreamingInstanceInvoker implements InstanceInvoker {

    private final InstanceInvoker delegate;
    private final ModeStreamService streamService;
    private final String runId;

    public StreamingInstanceInvoker(InstanceInvoker delegate, ModeStreamService streamService, String runId) {
        this.delegate = delegate;
        this.streamService = streamService;
        this.runId = runId;
    }

    @Override
    @Nullable
    public StreamResult invoke(InvocationRequest request) {
        StreamResult result = delegate.invoke(request);
        if (!request.token().isCancelled()) {
            streamService.emitInstanceOutput(runId, request.streamId(), request.modelId(),
                    result != null ? result.content() : null);
        }
        return result;
    }
}
