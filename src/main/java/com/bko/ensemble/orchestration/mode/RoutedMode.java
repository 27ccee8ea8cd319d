package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.ROUTING_FAILED_REASONING;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.RoutedState;
import com.bko.ensemble.orchestration.support.ModelNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A router instance picks which of the other instances answers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoutedMode implements ModeSpec<RoutedState> {

    private static final Pattern REASONING_SECTION =
            Pattern.compile("\\breasoning\\s*:\\s*(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final ModePromptService promptService;
    private final EnsembleProperties properties;

    @Override
    public ConversationMode mode() {
        return ConversationMode.ROUTED;
    }

    @Override
    public int minInstances() {
        return 1;
    }

    @Override
    public RoutedState initialize(ModeContext ctx) {
        ModelInstance router = router(ctx);
        return new RoutedState(RoutedState.Phase.ROUTING, router.modelId(), router.id(), null, null, null, false,
                null, null);
    }

    @Override
    public RoutedState execute(ModeContext ctx, RunnerHelpers<RoutedState> helpers) {
        ModelInstance router = router(ctx);
        List<ModelInstance> targets = helpers.instances().stream()
                .filter(instance -> !instance.id().equals(router.id()))
                .toList();

        if (targets.isEmpty()) {
            log.info("No routing targets besides {}; it answers directly.", router.modelId());
            helpers.setState(helpers.state().withDecision(router.modelId(), router.id(), null, false));
            StreamResult response = helpers.callSingle(router,
                    helpers.buildConversationInput(router.modelId(), ctx.userContent()));
            return helpers.state().withResponse(response);
        }

        RoutingDecision decision = route(ctx, helpers, router, targets);
        helpers.setState(helpers.state()
                .withRouterUsage(decision.usage())
                .withDecision(decision.selected().modelId(), decision.selected().id(), decision.reasoning(),
                        decision.fallback()));

        ModelInstance selected = decision.selected();
        StreamResult response = helpers.callSingle(selected,
                helpers.buildConversationInput(selected.modelId(), ctx.userContent()));
        return helpers.state().withResponse(response);
    }

    @Override
    public List<ModeResult> finalize(RoutedState state, ModeContext ctx) {
        StreamResult response = state.response();
        if (response == null || state.selectedInstanceId() == null) {
            return ModeResults.empty(ctx.instances());
        }
        MessageUsage total = MessageUsage.ZERO.plus(response.usage()).plus(state.routerUsage());
        return ModeResults.at(ctx.instances(), state.selectedInstanceId(), new ModeResult(response.content(),
                response.usage(), ModeMetadata.of(mode(), ResultKind.SELECTION, state, total)));
    }

    private RoutingDecision route(ModeContext ctx, RunnerHelpers<RoutedState> helpers, ModelInstance router,
                                  List<ModelInstance> targets) {
        List<String> targetNames = targets.stream().map(ModelInstance::displayName).toList();
        ModelParameters routingParameters = new ModelParameters(0.0, null, null,
                properties.getModes().getRouterMaxTokens(), null, null);
        StreamResult answer = helpers.callSingle(router, List.of(
                InputItem.system(promptService.routingPrompt(ctx.config(), targetNames)),
                InputItem.user(ctx.userContent())), routingParameters);

        if (answer == null) {
            log.warn("Routing failed, using fallback target {}.", targets.get(0).modelId());
            return new RoutingDecision(targets.get(0), ROUTING_FAILED_REASONING, true, null);
        }
        String output = answer.content().trim();
        Optional<ModelInstance> match = match(output, targets);
        if (match.isEmpty()) {
            log.warn("Router returned unrecognized model \"{}\", using fallback {}.", output, targets.get(0).modelId());
        }
        return new RoutingDecision(match.orElse(targets.get(0)), reasoning(output), match.isEmpty(), answer.usage());
    }

    /**
     * Case-insensitive: the router's answer equals or contains a target's model id or label.
     */
    static Optional<ModelInstance> match(String output, List<ModelInstance> targets) {
        String cleaned = output.trim().toLowerCase(Locale.ROOT);
        return targets.stream()
                .filter(target -> mentions(cleaned, target.modelId())
                        || (StringUtils.hasText(target.label()) && mentions(cleaned, target.label())))
                .findFirst();
    }

    private static boolean mentions(String cleaned, String name) {
        String candidate = name.toLowerCase(Locale.ROOT);
        return cleaned.equals(candidate) || cleaned.contains(candidate);
    }

    static String reasoning(String output) {
        Matcher matcher = REASONING_SECTION.matcher(output);
        if (matcher.find() && StringUtils.hasText(matcher.group(1))) {
            return matcher.group(1).trim();
        }
        return output.trim();
    }

    private ModelInstance router(ModeContext ctx) {
        ModeConfig config = ctx.config();
        return ModelNames.findSpecialInstance(ctx.instances(), config.routerInstanceId(), config.routerModel())
                .orElseThrow(() -> new IllegalStateException("Router instance not found"));
    }

    private record RoutingDecision(ModelInstance selected, String reasoning, boolean fallback,
                                   @Nullable MessageUsage usage) {
    }
}
