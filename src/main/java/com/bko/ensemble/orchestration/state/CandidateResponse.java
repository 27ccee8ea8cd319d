package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.model.UsageCarrier;
import org.springframework.lang.Nullable;

/**
 * One instance's answer. {@code model} is the instance's display name.
 */
public record CandidateResponse(
        String instanceId,
        String model,
        String content,
        @Nullable MessageUsage usage
) implements UsageCarrier {

    public static CandidateResponse from(ModelInstance instance, StreamResult result) {
        return new CandidateResponse(instance.id(), instance.displayName(), result.content(), result.usage());
    }
}
