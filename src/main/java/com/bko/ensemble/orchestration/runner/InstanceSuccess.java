package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.StreamResult;

public record InstanceSuccess(ModelInstance instance, StreamResult result, int index) {
}
