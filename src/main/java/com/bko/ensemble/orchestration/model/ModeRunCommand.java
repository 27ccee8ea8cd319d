package com.bko.ensemble.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

public record ModeRunCommand(
        ConversationMode mode,
        String message,
        List<ModelInstance> instances,
        @Nullable List<ChatMessage> history,
        @Nullable HistoryMode historyMode,
        @Nullable ModelParameters settings,
        @Nullable ModeConfig config
) {
}
