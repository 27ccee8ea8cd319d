package com.bko.ensemble.orchestration.support;

import com.bko.ensemble.orchestration.model.ModelInstance;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

public final class ModelNames {

    private ModelNames() {
    }

    /**
     * Last segment of a slash-delimited model id: {@code openai/gpt-4o} becomes {@code gpt-4o}.
     */
    public static String shortName(@Nullable String modelId) {
        if (modelId == null) {
            return "";
        }
        int slash = modelId.lastIndexOf('/');
        if (slash < 0) {
            return modelId;
        }
        String tail = modelId.substring(slash + 1);
        return tail.isEmpty() ? modelId : tail;
    }

    /**
     * Resolves a designated instance: configured instance id, then first instance running the configured model,
     * then the first instance.
     */
    public static Optional<ModelInstance> findSpecialInstance(List<ModelInstance> instances,
                                                              @Nullable String instanceId,
                                                              @Nullable String modelId) {
        if (StringUtils.hasText(instanceId)) {
            Optional<ModelInstance> byId = instances.stream()
                    .filter(instance -> instance.id().equals(instanceId))
                    .findFirst();
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (StringUtils.hasText(modelId)) {
            Optional<ModelInstance> byModel = instances.stream()
                    .filter(instance -> instance.modelId().equals(modelId))
                    .findFirst();
            if (byModel.isPresent()) {
                return byModel;
            }
        }
        return instances.stream().findFirst();
    }

    /**
     * Like {@link #findSpecialInstance} but without the first-instance default.
     */
    public static Optional<ModelInstance> findConfiguredInstance(List<ModelInstance> instances,
                                                                 @Nullable String instanceId,
                                                                 @Nullable String modelId) {
        if (!StringUtils.hasText(instanceId) && !StringUtils.hasText(modelId)) {
            return Optional.empty();
        }
        return instances.stream()
                .filter(instance -> instance.id().equals(instanceId))
                .findFirst()
                .or(() -> instances.stream()
                        .filter(instance -> instance.modelId().equals(modelId))
                        .findFirst());
    }

    public static int indexOf(List<ModelInstance> instances, String instanceId) {
        for (int i = 0; i < instances.size(); i++) {
            if (instances.get(i).id().equals(instanceId)) {
                return i;
            }
        }
        return -1;
    }
}
