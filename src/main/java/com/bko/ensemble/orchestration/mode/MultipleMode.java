package com.bko.ensemble.orchestration.mode;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.state.CandidateResponse;
import com.bko.ensemble.orchestration.state.MultipleState;
import com.bko.ensemble.orchestration.support.ModelNames;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Every instance answers on its own. Also serves as the fallback for modes that cannot run.
 */
@Component
public class MultipleMode implements ModeSpec<MultipleState> {

    @Override
    public ConversationMode mode() {
        return ConversationMode.MULTIPLE;
    }

    @Override
    public int minInstances() {
        return 1;
    }

    @Override
    public MultipleState initialize(ModeContext ctx) {
        return new MultipleState(MultipleState.Phase.RESPONDING, List.of());
    }

    @Override
    public MultipleState execute(ModeContext ctx, RunnerHelpers<MultipleState> helpers) {
        helpers.gather(helpers.instances(),
                instance -> helpers.buildConversationInput(instance.modelId(), ctx.userContent()),
                (call, result, index) -> {
                    if (result != null) {
                        helpers.updateState(state -> state.withResponse(CandidateResponse.from(call.instance(), result)));
                    }
                });
        return helpers.state().withPhase(MultipleState.Phase.DONE);
    }

    @Override
    public List<ModeResult> finalize(MultipleState state, ModeContext ctx) {
        List<ModeResult> results = ModeResults.empty(ctx.instances());
        for (CandidateResponse response : state.responses()) {
            int index = ModelNames.indexOf(ctx.instances(), response.instanceId());
            if (index >= 0) {
                results.set(index, new ModeResult(response.content(), response.usage(),
                        ModeMetadata.of(mode(), ResultKind.DIRECT, state, null)));
            }
        }
        return results;
    }
}
