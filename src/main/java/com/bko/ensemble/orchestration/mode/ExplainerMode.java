package com.bko.ensemble.orchestration.mode;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.ExplainerState;
import com.bko.ensemble.orchestration.state.ExplainerState.Explanation;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Explains the question once per audience level, from the most expert level down. Each level after the first
 * adapts the latest successful explanation. Levels are dealt to instances round-robin.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExplainerMode implements ModeSpec<ExplainerState> {

    private final ModePromptService promptService;
    private final EnsembleProperties properties;

    @Override
    public ConversationMode mode() {
        return ConversationMode.EXPLAINER;
    }

    @Override
    public int minInstances() {
        return 1;
    }

    @Override
    public boolean validate(ModeContext ctx) {
        return !levels(ctx).isEmpty();
    }

    @Override
    public ExplainerState initialize(ModeContext ctx) {
        return new ExplainerState(ExplainerState.Phase.INITIAL, levels(ctx), 0, List.of(),
                ctx.instances().get(0).modelId());
    }

    @Override
    public ExplainerState execute(ModeContext ctx, RunnerHelpers<ExplainerState> helpers) {
        List<String> levels = helpers.state().audienceLevels();
        List<ModelInstance> instances = helpers.instances();
        String question = ctx.userContent();
        String previous = null;

        for (int i = 0; i < levels.size(); i++) {
            String level = levels.get(i);
            ModelInstance instance = instances.get(i % instances.size());
            if (i > 0) {
                helpers.setState(helpers.state()
                        .withPhase(ExplainerState.Phase.SIMPLIFYING)
                        .withCurrentLevelIndex(i)
                        .withCurrentModel(instance.modelId()));
            }
            String prompt = previous == null
                    ? promptService.explainerInitialPrompt(level, question)
                    : promptService.explainerSimplifyPrompt(level, question, previous);
            List<InputItem> input = new ArrayList<>(helpers.buildHistoryInput(instance.modelId()));
            input.add(InputItem.system(prompt));
            input.add(InputItem.user(question));

            StreamResult result = helpers.callSingle(instance, input);
            if (result == null) {
                log.warn("No {} explanation from {}; moving on.", level, instance.id());
                continue;
            }
            previous = result.content();
            helpers.updateState(state -> state.withExplanation(new Explanation(level, instance.id(),
                    instance.modelId(), instance.label(), result.content(), result.usage())));
        }
        return helpers.state()
                .withPhase(ExplainerState.Phase.DONE)
                .withCurrentLevelIndex(levels.size() - 1)
                .withCurrentModel(null);
    }

    /**
     * One result per successful explanation, in level order rather than instance order.
     */
    @Override
    public List<ModeResult> finalize(ExplainerState state, ModeContext ctx) {
        List<ModeResult> results = new ArrayList<>();
        for (int i = 0; i < state.explanations().size(); i++) {
            Explanation explanation = state.explanations().get(i);
            ModeMetadata metadata = new ModeMetadata(mode(), ResultKind.VARIANT, capitalize(explanation.level()),
                    i == 0 ? state : null,
                    i == 0 ? UsageAggregator.aggregate(state.explanations()) : null);
            results.add(new ModeResult(explanation.content(), explanation.usage(), metadata));
        }
        return results;
    }

    private List<String> levels(ModeContext ctx) {
        List<String> configured = ctx.config().audienceLevels();
        return configured != null ? configured : properties.getModes().getAudienceLevels();
    }

    static String capitalize(String level) {
        return StringUtils.capitalize(level);
    }
}
