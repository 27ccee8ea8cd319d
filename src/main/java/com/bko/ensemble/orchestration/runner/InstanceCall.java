package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;
import org.springframework.lang.Nullable;

import java.util.List;

public record InstanceCall(
        ModelInstance instance,
        String streamId,
        List<InputItem> input,
        @Nullable ModelParameters overrides
) {

    public static InstanceCall of(ModelInstance instance, List<InputItem> input) {
        return new InstanceCall(instance, instance.id(), input, null);
    }

    public static InstanceCall of(ModelInstance instance, List<InputItem> input, @Nullable ModelParameters overrides) {
        return new InstanceCall(instance, instance.id(), input, overrides);
    }
}
