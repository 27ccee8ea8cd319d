package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.*;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.MessageUsage;
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
import com.bko.ensemble.orchestration.state.DebatedState;
import com.bko.ensemble.orchestration.state.DebatedState.DebateTurn;
import com.bko.ensemble.orchestration.support.ModelNames;
import com.bko.ensemble.orchestration.support.TranscriptEntry;
import com.bko.ensemble.orchestration.support.TranscriptFormatter;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Instances argue alternating pro and con positions over an opening round and a number of rebuttal rounds;
 * the summarizer then writes a balanced summary of the whole transcript.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DebatedMode implements ModeSpec<DebatedState> {

    private final ModePromptService promptService;
    private final EnsembleProperties properties;

    @Override
    public ConversationMode mode() {
        return ConversationMode.DEBATED;
    }

    @Override
    public int minInstances() {
        return 2;
    }

    @Override
    public DebatedState initialize(ModeContext ctx) {
        Integer configured = ctx.config().debateRounds();
        int totalRounds = configured != null ? configured : properties.getModes().getDebateRounds();
        ModelInstance summarizer = summarizer(ctx);
        return new DebatedState(DebatedState.Phase.OPENING, 0, totalRounds, assignPositions(ctx.instances()),
                List.of(), List.of(), summarizer.modelId(), summarizer.id(), null, null);
    }

    @Override
    public DebatedState execute(ModeContext ctx, RunnerHelpers<DebatedState> helpers) {
        List<ModelInstance> instances = helpers.instances();
        Map<String, String> positions = helpers.state().positions();
        ModeConfig config = ctx.config();
        String question = ctx.userContent();

        GatherResult opening = helpers.gather(instances, instance -> {
            List<InputItem> input = new ArrayList<>(helpers.buildHistoryInput(instance.modelId()));
            input.add(InputItem.system(promptService.debateOpeningPrompt(config, positions.get(instance.id()), question)));
            input.add(InputItem.user(DEBATE_OPENING_INSTRUCTION));
            return input;
        }, (call, result, index) -> recordTurn(helpers, call.instance(), result, 0));

        if (opening.successCount() < 2) {
            log.warn("Only {} opening argument(s); ending the debate early.", opening.successCount());
            return helpers.state().withPhase(DebatedState.Phase.DONE).withCurrentRoundTurns(List.of());
        }

        int totalRounds = helpers.state().totalRounds();
        Function<TranscriptEntry, String> positionLabel = entry -> positions.get(entry.instanceId());
        for (int round = 1; round <= totalRounds; round++) {
            int current = round;
            helpers.setState(helpers.state().startRound(DebatedState.Phase.DEBATING, round));
            String previousArguments = TranscriptFormatter.formatRound(helpers.state().turns(), round - 1, positionLabel);
            helpers.gather(instances, instance -> List.of(
                    InputItem.system(promptService.debateRebuttalPrompt(config, positions.get(instance.id()), question,
                            previousArguments)),
                    InputItem.user(DEBATE_REBUTTAL_INSTRUCTION)),
                    (call, result, index) -> recordTurn(helpers, call.instance(), result, current));
        }

        helpers.setState(helpers.state().withPhase(DebatedState.Phase.SUMMARIZING).withCurrentRoundTurns(List.of()));
        String transcript = TranscriptFormatter.formatRounds(helpers.state().turns(),
                round -> round == 0 ? "Opening Statements" : "Round " + round + " Rebuttals", positionLabel);
        StreamResult summary = helpers.callSingle(summarizer(ctx), List.of(
                InputItem.system(promptService.debateSummaryPrompt(question, transcript)),
                InputItem.user(DEBATE_SUMMARY_INSTRUCTION)));
        if (summary == null) {
            log.warn("Debate summary failed; using the fallback summary.");
        }
        return helpers.state()
                .withPhase(DebatedState.Phase.DONE)
                .withSummary(summary != null ? summary.content() : DEBATE_SUMMARY_FALLBACK)
                .withSummaryUsage(summary != null ? summary.usage() : null);
    }

    @Override
    public List<ModeResult> finalize(DebatedState state, ModeContext ctx) {
        if (state.summary() != null) {
            MessageUsage total = UsageAggregator.aggregate(state.turns(), state.summaryUsage());
            ModeMetadata metadata = new ModeMetadata(mode(), ResultKind.SYNTHESIS,
                    ModelNames.shortName(state.summarizerModel()), state, total);
            return ModeResults.at(ctx.instances(), state.summarizerInstanceId(),
                    new ModeResult(state.summary(), state.summaryUsage(), metadata));
        }
        if (state.turns().size() == 1) {
            DebateTurn only = state.turns().get(0);
            return ModeResults.at(ctx.instances(), only.instanceId(), new ModeResult(only.content(), only.usage(),
                    new ModeMetadata(mode(), ResultKind.DIRECT, only.position(), state, only.usage())));
        }
        return ModeResults.empty(ctx.instances());
    }

    static Map<String, String> assignPositions(List<ModelInstance> instances) {
        Map<String, String> positions = new LinkedHashMap<>();
        for (int i = 0; i < instances.size(); i++) {
            positions.put(instances.get(i).id(), DEBATE_POSITIONS.get(i % DEBATE_POSITIONS.size()));
        }
        return positions;
    }

    private void recordTurn(RunnerHelpers<DebatedState> helpers, ModelInstance instance, StreamResult result,
                            int round) {
        if (result == null) {
            return;
        }
        helpers.updateState(state -> state.withTurn(new DebateTurn(instance.id(), instance.displayName(),
                state.positions().get(instance.id()), result.content(), round, result.usage())));
    }

    private ModelInstance summarizer(ModeContext ctx) {
        ModeConfig config = ctx.config();
        return ModelNames.findSpecialInstance(ctx.instances(), config.synthesizerInstanceId(), config.synthesizerModel())
                .orElseThrow(() -> new IllegalStateException("Summarizer instance not found"));
    }
}
