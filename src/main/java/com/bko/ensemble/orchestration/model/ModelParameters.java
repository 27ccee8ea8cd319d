package com.bko.ensemble.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelParameters(
        @Nullable Double temperature,
        @Nullable Double topP,
        @Nullable Integer topK,
        @Nullable Integer maxTokens,
        @Nullable Double frequencyPenalty,
        @Nullable Double presencePenalty
) {

    private static final ModelParameters EMPTY = new ModelParameters(null, null, null, null, null, null);

    public static ModelParameters empty() {
        return EMPTY;
    }

    public static ModelParameters ofTemperature(double temperature) {
        return new ModelParameters(temperature, null, null, null, null, null);
    }

    public static ModelParameters ofMaxTokens(int maxTokens) {
        return new ModelParameters(null, null, null, maxTokens, null, null);
    }

    /**
     * Values set on {@code override} win; unset values keep this instance's value.
     */
    public ModelParameters merge(@Nullable ModelParameters override) {
        if (override == null) {
            return this;
        }
        return new ModelParameters(
                override.temperature != null ? override.temperature : temperature,
                override.topP != null ? override.topP : topP,
                override.topK != null ? override.topK : topK,
                override.maxTokens != null ? override.maxTokens : maxTokens,
                override.frequencyPenalty != null ? override.frequencyPenalty : frequencyPenalty,
                override.presencePenalty != null ? override.presencePenalty : presencePenalty);
    }

    public boolean isEmpty() {
        return temperature == null && topP == null && topK == null && maxTokens == null
                && frequencyPenalty == null && presencePenalty == null;
    }
}
