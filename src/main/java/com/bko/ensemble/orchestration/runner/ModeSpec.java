package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.state.ModeState;

import java.util.List;

/**
 * One collaboration strategy, driven by {@link ModeRunner}.
 *
 * @param <S> the state variant this mode publishes
 */
public interface ModeSpec<S extends ModeState> {

    ConversationMode mode();

    int minInstances();

    /**
     * Extra eligibility check applied after the instance-count check. A {@code false} result hands the
     * run to the fallback before any state is published.
     */
    default boolean validate(ModeContext ctx) {
        return true;
    }

    S initialize(ModeContext ctx);

    S execute(ModeContext ctx, RunnerHelpers<S> helpers);

    /**
     * Reduces the final state to the caller-visible results. Unless a mode documents otherwise the list is
     * positional over {@link ModeContext#instances()} with {@code null} where nothing was produced.
     */
    List<ModeResult> finalize(S state, ModeContext ctx);
}
