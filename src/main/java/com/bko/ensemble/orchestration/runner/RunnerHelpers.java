package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.state.ModeState;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Capabilities the runner hands to a mode's {@code execute}. Every call is made from the run's own thread;
 * completion listeners are invoked on that thread too, one at a time.
 */
public interface RunnerHelpers<S extends ModeState> {

    S state();

    List<ModelInstance> instances();

    /**
     * Calls every instance concurrently and waits until all calls have settled. Each call gets a token from a
     * fresh {@link CancellationGroup} that replaces the previous round's group.
     */
    GatherResult gather(List<ModelInstance> instances,
                        Function<ModelInstance, List<InputItem>> inputBuilder,
                        @Nullable CompletionListener listener);

    GatherResult gatherCalls(List<InstanceCall> calls, @Nullable CompletionListener listener);

    /**
     * Runs every chain concurrently; the calls inside one chain run one after another. Results and listener
     * indexes are positional over the chains flattened in order.
     */
    GatherResult gatherChains(List<List<InstanceCall>> chains, @Nullable CompletionListener listener);

    @Nullable
    StreamResult callSingle(ModelInstance instance, List<InputItem> input);

    @Nullable
    StreamResult callSingle(ModelInstance instance, List<InputItem> input, @Nullable ModelParameters overrides);

    void setState(S state);

    void updateState(UnaryOperator<S> updater);

    /**
     * Prior history relevant to {@code modelId} followed by {@code userContent} as the trailing user turn.
     */
    List<InputItem> buildConversationInput(String modelId, String userContent);

    /**
     * Same as {@link #buildConversationInput} without the trailing user turn.
     */
    List<InputItem> buildHistoryInput(String modelId);

    boolean isCancelled();

    @FunctionalInterface
    interface CompletionListener {
        void onComplete(InstanceCall call, @Nullable StreamResult result, int index);
    }
}
