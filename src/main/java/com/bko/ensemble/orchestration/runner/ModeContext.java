package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.ChatMessage;
import com.bko.ensemble.orchestration.model.HistoryMode;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Everything a run needs from its caller. Immutable; {@link #withUserContent} is applied by the runner.
 */
public record ModeContext(
        List<ModelInstance> instances,
        List<ChatMessage> history,
        HistoryMode historyMode,
        ModelParameters settings,
        ModeConfig config,
        InstanceInvoker invoker,
        ModeStatePublisher publisher,
        BooleanSupplier cancelled,
        String userContent
) {

    public ModeContext {
        instances = List.copyOf(instances);
        history = history == null ? List.of() : List.copyOf(history);
        historyMode = historyMode == null ? HistoryMode.ALL : historyMode;
        settings = settings == null ? ModelParameters.empty() : settings;
        config = config == null ? ModeConfig.empty() : config;
        publisher = publisher == null ? ModeStatePublisher.NOOP : publisher;
        cancelled = cancelled == null ? () -> false : cancelled;
        userContent = userContent == null ? "" : userContent;
    }

    public static ModeContext of(List<ModelInstance> instances, InstanceInvoker invoker, ModeStatePublisher publisher) {
        return new ModeContext(instances, List.of(), HistoryMode.ALL, ModelParameters.empty(), ModeConfig.empty(),
                invoker, publisher, () -> false, "");
    }

    public ModeContext withUserContent(String content) {
        return new ModeContext(instances, history, historyMode, settings, config, invoker, publisher, cancelled,
                content);
    }

    public ModeContext withConfig(ModeConfig modeConfig) {
        return new ModeContext(instances, history, historyMode, settings, modeConfig, invoker, publisher, cancelled,
                userContent);
    }

    public ModeContext withHistory(List<ChatMessage> messages, HistoryMode mode) {
        return new ModeContext(instances, messages, mode, settings, config, invoker, publisher, cancelled,
                userContent);
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }
}
