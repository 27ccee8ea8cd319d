package com.bko.ensemble.orchestration.mode;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.CandidateResponse;
import com.bko.ensemble.orchestration.state.CritiquedState;
import com.bko.ensemble.orchestration.support.ModelNames;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The primary instance answers, every other instance critiques that answer, and the primary revises.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CritiquedMode implements ModeSpec<CritiquedState> {

    private final ModePromptService promptService;

    @Override
    public ConversationMode mode() {
        return ConversationMode.CRITIQUED;
    }

    @Override
    public int minInstances() {
        return 1;
    }

    @Override
    public boolean validate(ModeContext ctx) {
        return !SynthesizedMode.responders(ctx.instances(), primary(ctx)).isEmpty();
    }

    @Override
    public CritiquedState initialize(ModeContext ctx) {
        ModelInstance primary = primary(ctx);
        List<String> critics = SynthesizedMode.responders(ctx.instances(), primary).stream()
                .map(ModelInstance::modelId)
                .toList();
        return new CritiquedState(CritiquedState.Phase.INITIAL, primary.modelId(), primary.id(), critics,
                null, null, List.of(), null);
    }

    @Override
    public CritiquedState execute(ModeContext ctx, RunnerHelpers<CritiquedState> helpers) {
        ModelInstance primary = primary(ctx);
        StreamResult initial = helpers.callSingle(primary,
                helpers.buildConversationInput(primary.modelId(), ctx.userContent()));
        if (initial == null) {
            log.warn("Primary instance {} produced no initial answer.", primary.id());
            return helpers.state().withPhase(CritiquedState.Phase.DONE);
        }
        helpers.setState(helpers.state()
                .withPhase(CritiquedState.Phase.CRITIQUING)
                .withInitialResponse(initial.content())
                .withInitialUsage(initial.usage()));

        List<InputItem> critiqueInput = List.of(
                InputItem.system(promptService.critiquePrompt(ctx.config(), initial.content())),
                InputItem.user(ctx.userContent()));
        helpers.gather(SynthesizedMode.responders(helpers.instances(), primary), instance -> critiqueInput,
                (call, result, index) -> {
                    if (result != null) {
                        helpers.updateState(state -> state.withCritique(CandidateResponse.from(call.instance(), result)));
                    }
                });
        List<CandidateResponse> critiques = helpers.state().critiques();
        if (critiques.isEmpty()) {
            log.warn("No critiques received; returning the initial answer.");
            return helpers.state().withPhase(CritiquedState.Phase.DONE);
        }

        helpers.setState(helpers.state().withPhase(CritiquedState.Phase.REVISING));
        String critiquesText = ModeResults.joinSources(critiques, CandidateResponse::model, CandidateResponse::content);
        StreamResult revision = helpers.callSingle(primary, List.of(
                InputItem.system(promptService.revisionPrompt(initial.content(), critiquesText)),
                InputItem.user(ctx.userContent())));
        if (revision == null) {
            log.warn("Revision failed; keeping the initial answer.");
        }
        return helpers.state().withPhase(CritiquedState.Phase.DONE).withRevision(revision);
    }

    @Override
    public List<ModeResult> finalize(CritiquedState state, ModeContext ctx) {
        if (state.initialResponse() == null) {
            return ModeResults.empty(ctx.instances());
        }
        StreamResult revision = state.revision();
        String content = revision != null ? revision.content() : state.initialResponse();
        ModeMetadata metadata = new ModeMetadata(mode(),
                revision != null ? ResultKind.SYNTHESIS : ResultKind.DIRECT,
                ModelNames.shortName(state.primaryModel()), state,
                UsageAggregator.aggregate(state.critiques(), state.initialUsage(),
                        revision != null ? revision.usage() : null));
        return ModeResults.at(ctx.instances(), state.primaryInstanceId(),
                new ModeResult(content, revision != null ? revision.usage() : state.initialUsage(), metadata));
    }

    private ModelInstance primary(ModeContext ctx) {
        ModeConfig config = ctx.config();
        return ModelNames.findSpecialInstance(ctx.instances(), config.primaryInstanceId(), config.primaryModel())
                .orElseThrow(() -> new IllegalStateException("Primary instance not found"));
    }
}
