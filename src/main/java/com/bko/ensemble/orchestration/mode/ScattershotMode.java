package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.VARIATION_ID_SEPARATOR;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.InstanceCall;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.state.ScattershotState;
import com.bko.ensemble.orchestration.state.ScattershotState.Variation;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the first instance once per parameter variation, all in parallel, so the outputs can be compared.
 */
@Component
@Slf4j
public class ScattershotMode implements ModeSpec<ScattershotState> {

    static final List<ModelParameters> DEFAULT_VARIATIONS = List.of(
            ModelParameters.ofTemperature(0.0),
            ModelParameters.ofTemperature(0.5),
            ModelParameters.ofTemperature(1.0),
            new ModelParameters(1.5, 0.9, null, null, null, null));

    @Override
    public ConversationMode mode() {
        return ConversationMode.SCATTERSHOT;
    }

    @Override
    public int minInstances() {
        return 1;
    }

    @Override
    public ScattershotState initialize(ModeContext ctx) {
        ModelInstance target = ctx.instances().get(0);
        List<ModelParameters> params = CollectionUtils.isEmpty(ctx.config().parameterVariations())
                ? DEFAULT_VARIATIONS
                : ctx.config().parameterVariations();
        List<Variation> variations = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            variations.add(new Variation(target.id() + VARIATION_ID_SEPARATOR + i, i, params.get(i),
                    label(params.get(i), i), Variation.Status.PENDING, null, null));
        }
        return new ScattershotState(ScattershotState.Phase.GENERATING, target.modelId(), target.id(), variations);
    }

    @Override
    public ScattershotState execute(ModeContext ctx, RunnerHelpers<ScattershotState> helpers) {
        ModelInstance target = helpers.instances().get(0);
        List<Variation> variations = helpers.state().variations();
        helpers.setState(helpers.state().withVariations(variations.stream()
                .map(variation -> variation.withStatus(Variation.Status.GENERATING))
                .toList()));

        List<InstanceCall> calls = variations.stream()
                .map(variation -> new InstanceCall(target, variation.id(),
                        helpers.buildConversationInput(target.modelId(), ctx.userContent()), variation.params()))
                .toList();
        helpers.gatherCalls(calls, (call, result, index) -> {
            Variation variation = variations.get(index);
            Variation settled = result == null
                    ? variation.withStatus(Variation.Status.FAILED)
                    : variation.withStatus(Variation.Status.COMPLETE)
                            .withContent(result.content())
                            .withUsage(result.usage());
            helpers.updateState(state -> state.withVariation(settled));
        });
        long completed = helpers.state().variations().stream()
                .filter(variation -> variation.status() == Variation.Status.COMPLETE)
                .count();
        log.info("Scattershot on {} finished {}/{} variation(s).", target.id(), completed, variations.size());
        return helpers.state().withPhase(ScattershotState.Phase.DONE);
    }

    /**
     * One result per completed variation, in variation order.
     */
    @Override
    public List<ModeResult> finalize(ScattershotState state, ModeContext ctx) {
        List<Variation> completed = state.variations().stream()
                .filter(variation -> variation.status() == Variation.Status.COMPLETE)
                .toList();
        List<ModeResult> results = new ArrayList<>();
        for (int i = 0; i < completed.size(); i++) {
            Variation variation = completed.get(i);
            ModeMetadata metadata = new ModeMetadata(mode(), ResultKind.VARIANT, variation.label(),
                    i == 0 ? state : null, i == 0 ? UsageAggregator.aggregate(completed) : null);
            results.add(new ModeResult(variation.content(), variation.usage(), metadata));
        }
        return results;
    }

    static String label(ModelParameters params, int index) {
        List<String> parts = new ArrayList<>();
        addPart(parts, "temp", params.temperature());
        addPart(parts, "top_p", params.topP());
        addPart(parts, "top_k", params.topK());
        addPart(parts, "freq", params.frequencyPenalty());
        addPart(parts, "pres", params.presencePenalty());
        addPart(parts, "max", params.maxTokens());
        return parts.isEmpty() ? "Variation " + (index + 1) : String.join(", ", parts);
    }

    private static void addPart(List<String> parts, String name, @Nullable Number value) {
        if (value == null) {
            return;
        }
        String text = value instanceof Double number
                ? BigDecimal.valueOf(number).stripTrailingZeros().toPlainString()
                : value.toString();
        parts.add(name + "=" + text);
    }
}
