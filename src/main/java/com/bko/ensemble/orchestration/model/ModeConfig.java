package com.bko.ensemble.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Per-run overrides. Every field is optional; modes fall back to {@code ensemble.modes.*} defaults.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModeConfig(
        @Nullable String synthesizerInstanceId,
        @Nullable String synthesizerModel,
        @Nullable String routerInstanceId,
        @Nullable String routerModel,
        @Nullable String primaryInstanceId,
        @Nullable String primaryModel,
        @Nullable String coordinatorInstanceId,
        @Nullable String coordinatorModel,
        @Nullable String routingPrompt,
        @Nullable String synthesisPrompt,
        @Nullable String votingPrompt,
        @Nullable String consensusPrompt,
        @Nullable String critiquePrompt,
        @Nullable String confidencePrompt,
        @Nullable String debatePrompt,
        @Nullable String councilPrompt,
        @Nullable String decompositionPrompt,
        @Nullable String hierarchicalWorkerPrompt,
        @Nullable Integer debateRounds,
        @Nullable Integer maxConsensusRounds,
        @Nullable Double consensusThreshold,
        @Nullable Boolean councilAutoAssignRoles,
        @Nullable Map<String, String> councilRoles,
        @Nullable List<String> audienceLevels,
        @Nullable List<ModelParameters> parameterVariations
) {

    public static ModeConfig empty() {
        return builder().build();
    }
}
