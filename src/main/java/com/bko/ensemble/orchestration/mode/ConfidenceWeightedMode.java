package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.RESPONSE_SEPARATOR;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.GatherResult;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.ConfidenceState;
import com.bko.ensemble.orchestration.state.ConfidenceState.ConfidenceResponse;
import com.bko.ensemble.orchestration.support.ModelNames;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Responders answer with a trailing {@code CONFIDENCE: x} line; the synthesizer weighs answers by that score.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfidenceWeightedMode implements ModeSpec<ConfidenceState> {

    static final double DEFAULT_CONFIDENCE = 0.5;
    private static final Pattern CONFIDENCE_TRAILER =
            Pattern.compile("\\n?\\s*CONFIDENCE:\\s*([\\d.]+)\\s*$", Pattern.CASE_INSENSITIVE);

    private final ModePromptService promptService;

    @Override
    public ConversationMode mode() {
        return ConversationMode.CONFIDENCE_WEIGHTED;
    }

    @Override
    public int minInstances() {
        return 2;
    }

    @Override
    public boolean validate(ModeContext ctx) {
        return synthesizer(ctx)
                .map(synthesizer -> !SynthesizedMode.responders(ctx.instances(), synthesizer).isEmpty())
                .orElse(false);
    }

    @Override
    public ConfidenceState initialize(ModeContext ctx) {
        ModelInstance synthesizer = requireSynthesizer(ctx);
        return new ConfidenceState(ConfidenceState.Phase.GATHERING, synthesizer.modelId(), synthesizer.id(),
                List.of(), SynthesizedMode.responders(ctx.instances(), synthesizer).size(), null);
    }

    @Override
    public ConfidenceState execute(ModeContext ctx, RunnerHelpers<ConfidenceState> helpers) {
        ModelInstance synthesizer = requireSynthesizer(ctx);
        String responsePrompt = promptService.confidenceResponsePrompt(ctx.config(), ctx.userContent());
        GatherResult gathered = helpers.gather(SynthesizedMode.responders(helpers.instances(), synthesizer),
                instance -> {
                    List<InputItem> input = new ArrayList<>(helpers.buildHistoryInput(instance.modelId()));
                    input.add(InputItem.system(responsePrompt));
                    input.add(InputItem.user(ctx.userContent()));
                    return input;
                },
                (call, result, index) -> {
                    if (result != null) {
                        ParsedConfidence parsed = parseConfidence(result.content());
                        ModelInstance instance = call.instance();
                        helpers.updateState(state -> state.withResponse(new ConfidenceResponse(instance.id(),
                                instance.displayName(), parsed.content(), parsed.confidence(), result.usage())));
                    }
                });
        if (gathered.successCount() == 0) {
            log.warn("No confidence-rated responses were produced.");
            return helpers.state().withPhase(ConfidenceState.Phase.DONE);
        }

        helpers.setState(helpers.state().withPhase(ConfidenceState.Phase.SYNTHESIZING));
        List<ConfidenceResponse> ranked = new ArrayList<>(helpers.state().responses());
        ranked.sort(Comparator.comparingDouble(ConfidenceResponse::confidence).reversed());
        String responsesText = ranked.stream()
                .map(response -> "[" + response.model() + "] (Confidence: " + percent(response.confidence())
                        + "):\n" + response.content())
                .collect(Collectors.joining(RESPONSE_SEPARATOR));
        StreamResult synthesis = helpers.callSingle(synthesizer, List.of(
                InputItem.system(promptService.confidenceSynthesisPrompt(ctx.config(), responsesText)),
                InputItem.user(ctx.userContent())));
        return helpers.state().withPhase(ConfidenceState.Phase.DONE).withSynthesis(synthesis);
    }

    @Override
    public List<ModeResult> finalize(ConfidenceState state, ModeContext ctx) {
        StreamResult synthesis = state.synthesis();
        if (synthesis == null) {
            return ModeResults.empty(ctx.instances());
        }
        ModeMetadata metadata = ModeMetadata.of(mode(), ResultKind.SYNTHESIS, state,
                UsageAggregator.aggregate(state.responses(), synthesis.usage()));
        return ModeResults.at(ctx.instances(), state.synthesizerInstanceId(),
                new ModeResult(synthesis.content(), synthesis.usage(), metadata));
    }

    /**
     * Scores in {@code [0, 1]} are taken as is, scores in {@code (1, 100]} as percentages; anything else
     * falls back to {@value #DEFAULT_CONFIDENCE}. The trailer is removed only when it was recognised.
     */
    static ParsedConfidence parseConfidence(String raw) {
        Matcher matcher = CONFIDENCE_TRAILER.matcher(raw);
        if (!matcher.find()) {
            return new ParsedConfidence(raw, DEFAULT_CONFIDENCE);
        }
        double confidence = DEFAULT_CONFIDENCE;
        try {
            double score = Double.parseDouble(matcher.group(1));
            if (score >= 0 && score <= 1) {
                confidence = score;
            } else if (score > 1 && score <= 100) {
                confidence = score / 100;
            }
        } catch (NumberFormatException ex) {
            log.debug("Unreadable confidence score '{}'", matcher.group(1));
        }
        return new ParsedConfidence(raw.substring(0, matcher.start()).stripTrailing(), confidence);
    }

    private static String percent(double confidence) {
        return String.format(Locale.ROOT, "%.0f%%", confidence * 100);
    }

    private Optional<ModelInstance> synthesizer(ModeContext ctx) {
        ModeConfig config = ctx.config();
        return ModelNames.findSpecialInstance(ctx.instances(), config.synthesizerInstanceId(), config.synthesizerModel());
    }

    private ModelInstance requireSynthesizer(ModeContext ctx) {
        return synthesizer(ctx).orElseThrow(() -> new IllegalStateException("Synthesizer instance not found"));
    }

    record ParsedConfidence(String content, double confidence) {
    }
}
