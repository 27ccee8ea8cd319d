package com.bko.ensemble.orchestration.mode;

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
import com.bko.ensemble.orchestration.state.CandidateResponse;
import com.bko.ensemble.orchestration.state.SynthesizedState;
import com.bko.ensemble.orchestration.support.ModelNames;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Non-synthesizer instances answer in parallel; the synthesizer merges their answers into one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SynthesizedMode implements ModeSpec<SynthesizedState> {

    private final ModePromptService promptService;

    @Override
    public ConversationMode mode() {
        return ConversationMode.SYNTHESIZED;
    }

    @Override
    public int minInstances() {
        return 2;
    }

    @Override
    public boolean validate(ModeContext ctx) {
        return !responders(ctx.instances(), synthesizer(ctx)).isEmpty();
    }

    @Override
    public SynthesizedState initialize(ModeContext ctx) {
        ModelInstance synthesizer = synthesizer(ctx);
        return new SynthesizedState(SynthesizedState.Phase.GATHERING, synthesizer.modelId(), synthesizer.id(),
                List.of(), 0, responders(ctx.instances(), synthesizer).size(), null);
    }

    @Override
    public SynthesizedState execute(ModeContext ctx, RunnerHelpers<SynthesizedState> helpers) {
        ModelInstance synthesizer = synthesizer(ctx);
        GatherResult gathered = helpers.gather(responders(helpers.instances(), synthesizer),
                instance -> helpers.buildConversationInput(instance.modelId(), ctx.userContent()),
                (call, result, index) -> {
                    if (result != null) {
                        helpers.updateState(state -> state.withResponse(CandidateResponse.from(call.instance(), result)));
                    }
                });
        if (gathered.successCount() == 0) {
            log.warn("No responses to synthesize from {} responders.", gathered.calls().size());
            return helpers.state().withPhase(SynthesizedState.Phase.DONE);
        }

        helpers.setState(helpers.state().withPhase(SynthesizedState.Phase.SYNTHESIZING));
        String sources = ModeResults.joinSources(helpers.state().sourceResponses(),
                CandidateResponse::model, CandidateResponse::content);
        StreamResult synthesis = helpers.callSingle(synthesizer, List.of(
                InputItem.system(promptService.synthesisPrompt(ctx.config(), sources)),
                InputItem.user(ctx.userContent())));
        return helpers.state().withPhase(SynthesizedState.Phase.DONE).withSynthesis(synthesis);
    }

    @Override
    public List<ModeResult> finalize(SynthesizedState state, ModeContext ctx) {
        StreamResult synthesis = state.synthesis();
        if (synthesis == null) {
            return ModeResults.empty(ctx.instances());
        }
        ModeMetadata metadata = ModeMetadata.of(mode(), ResultKind.SYNTHESIS, state,
                UsageAggregator.aggregate(state.sourceResponses(), synthesis.usage()));
        return ModeResults.at(ctx.instances(), state.synthesizerInstanceId(),
                new ModeResult(synthesis.content(), synthesis.usage(), metadata));
    }

    private ModelInstance synthesizer(ModeContext ctx) {
        ModeConfig config = ctx.config();
        return ModelNames.findSpecialInstance(ctx.instances(), config.synthesizerInstanceId(), config.synthesizerModel())
                .orElseThrow(() -> new IllegalStateException("Synthesizer instance not found"));
    }

    static List<ModelInstance> responders(List<ModelInstance> instances, ModelInstance excluded) {
        return instances.stream()
                .filter(instance -> !instance.id().equals(excluded.id()))
                .toList();
    }
}
