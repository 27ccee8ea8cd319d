package com.bko.ensemble.api;

import com.bko.ensemble.orchestration.model.ChatMessage;
import com.bko.ensemble.orchestration.model.HistoryMode;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ModeRunRequest(
        @NotBlank String mode,
        @NotBlank String message,
        @NotEmpty List<@Valid ModelInstance> instances,
        List<@Valid ChatMessage> history,
        HistoryMode historyMode,
        ModelParameters settings,
        ModeConfig config
) {
}
