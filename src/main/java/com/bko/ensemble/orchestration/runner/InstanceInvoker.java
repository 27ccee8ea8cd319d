package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.StreamResult;
import org.springframework.lang.Nullable;

/**
 * Calls one model. Returns {@code null} when the call produced nothing; the runner never asks why.
 */
@FunctionalInterface
public interface InstanceInvoker {

    @Nullable
    StreamResult invoke(InvocationRequest request);
}
