package com.bko.ensemble.orchestration.model;

import jakarta.validation.constraints.NotBlank;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

public record ModelInstance(
        @NotBlank String id,
        @NotBlank String modelId,
        @Nullable String label,
        @Nullable ModelParameters parameters
) {

    public static ModelInstance of(String id, String modelId) {
        return new ModelInstance(id, modelId, null, null);
    }

    public static ModelInstance labelled(String id, String modelId, String label) {
        return new ModelInstance(id, modelId, label, null);
    }

    public String displayName() {
        return StringUtils.hasText(label) ? label : modelId;
    }
}
