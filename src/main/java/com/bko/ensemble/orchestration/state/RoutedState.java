package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * {@code selectedModel}, {@code selectedInstanceId} and {@code isFallback} are set together once routing
 * has decided.
 */
@With
@JsonTypeName("routed")
public record RoutedState(
        Phase phase,
        String routerModel,
        String routerInstanceId,
        @Nullable String selectedModel,
        @Nullable String selectedInstanceId,
        @Nullable String reasoning,
        boolean isFallback,
        @Nullable MessageUsage routerUsage,
        @Nullable StreamResult response
) implements ModeState {

    @Override
    public ConversationMode mode() {
        return ConversationMode.ROUTED;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public RoutedState withDecision(String model, String instanceId, @Nullable String decisionReasoning,
                                    boolean fallback) {
        return new RoutedState(Phase.SELECTED, routerModel, routerInstanceId, model, instanceId,
                decisionReasoning, fallback, routerUsage, response);
    }

    public enum Phase {
        ROUTING, SELECTED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
