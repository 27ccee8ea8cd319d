package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModelParameters;
import org.springframework.lang.Nullable;

import java.util.List;

public record InvocationRequest(
        String modelId,
        List<InputItem> input,
        CancellationToken token,
        ModelParameters parameters,
        String streamId,
        @Nullable String label
) {
}
