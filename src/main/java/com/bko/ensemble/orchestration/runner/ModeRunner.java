package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.service.ModeMetricsService;
import com.bko.ensemble.orchestration.state.ModeState;
import com.bko.ensemble.orchestration.support.MessageHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Drives a {@link ModeSpec} through eligibility, initialization, execution and finalization.
 * <p>
 * Model calls run on the worker pool. Their completions are handed back to the calling thread, which applies
 * listeners and state changes one at a time, so mode logic never races with itself.
 */
@Service
@Slf4j
public class ModeRunner {

    private static final long CANCEL_POLL_MILLIS = 200;

    private final ExecutorService workerExecutor;
    private final ModeMetricsService metricsService;

    public ModeRunner(@Qualifier("workerExecutor") ExecutorService workerExecutor,
                      ModeMetricsService metricsService) {
        this.workerExecutor = workerExecutor;
        this.metricsService = metricsService;
    }

    public <S extends ModeState> List<ModeResult> run(ModeSpec<S> spec, String userContent, ModeContext context,
                                                      ModeFallback fallback) {
        ModeContext ctx = context.withUserContent(userContent);
        int instanceCount = ctx.instances().size();
        if (instanceCount < spec.minInstances() || !spec.validate(ctx)) {
            metricsService.recordFallback(spec.mode(), instanceCount);
            return fallback.respond(userContent);
        }
        metricsService.recordRun(spec.mode(), instanceCount);

        Execution<S> execution = new Execution<>(spec, ctx);
        execution.setState(spec.initialize(ctx));
        S finalState;
        try {
            finalState = spec.execute(ctx, execution);
        } catch (RuntimeException ex) {
            log.warn("Mode {} failed in phase {}: {}", spec.mode().id(), execution.state().phaseName(),
                    ex.getMessage());
            execution.cancelActive();
            throw ex;
        }
        execution.setState(finalState);
        List<ModeResult> results = spec.finalize(finalState, ctx);
        log.info("Mode {} finished (phase={}, results={}).", spec.mode().id(), finalState.phaseName(),
                results.stream().filter(result -> result != null).count());
        return results;
    }

    private final class Execution<S extends ModeState> implements RunnerHelpers<S> {

        private final ModeSpec<S> spec;
        private final ModeContext ctx;
        private volatile CancellationGroup activeGroup = CancellationGroup.empty();
        private S state;

        private Execution(ModeSpec<S> spec, ModeContext ctx) {
            this.spec = spec;
            this.ctx = ctx;
        }

        @Override
        public S state() {
            return state;
        }

        @Override
        public List<ModelInstance> instances() {
            return ctx.instances();
        }

        @Override
        public GatherResult gather(List<ModelInstance> instances,
                                   Function<ModelInstance, List<InputItem>> inputBuilder,
                                   @Nullable CompletionListener listener) {
            List<InstanceCall> calls = instances.stream()
                    .map(instance -> InstanceCall.of(instance, inputBuilder.apply(instance)))
                    .toList();
            return gatherCalls(calls, listener);
        }

        @Override
        public GatherResult gatherCalls(List<InstanceCall> calls, @Nullable CompletionListener listener) {
            return gatherChains(calls.stream().map(call -> List.of(call)).toList(), listener);
        }

        @Override
        public GatherResult gatherChains(List<List<InstanceCall>> chains, @Nullable CompletionListener listener) {
            List<InstanceCall> calls = chains.stream().flatMap(List::stream).toList();
            List<StreamResult> ordered = new ArrayList<>(Collections.nCopies(calls.size(), null));
            List<InstanceSuccess> successes = new ArrayList<>();
            if (calls.isEmpty()) {
                return new GatherResult(calls, ordered, successes);
            }
            CancellationGroup group = CancellationGroup.of(calls.size());
            activeGroup = group;
            if (ctx.isCancelled()) {
                log.info("Run for mode {} was cancelled; skipping {} calls.", spec.mode().id(), calls.size());
                group.cancelAll();
            }

            Map<String, String> modelsByStreamId = new LinkedHashMap<>();
            for (InstanceCall call : calls) {
                modelsByStreamId.putIfAbsent(call.streamId(), call.instance().modelId());
            }
            ctx.publisher().initStreaming(new ArrayList<>(modelsByStreamId.keySet()), modelsByStreamId);

            AtomicReferenceArray<StreamResult> results = new AtomicReferenceArray<>(calls.size());
            Set<Integer> reported = ConcurrentHashMap.newKeySet();
            BlockingQueue<Integer> completed = new LinkedBlockingQueue<>();
            int offset = 0;
            for (List<InstanceCall> chain : chains) {
                int first = offset;
                int end = offset + chain.size();
                offset = end;
                if (first == end) {
                    continue;
                }
                CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                    for (int index = first; index < end; index++) {
                        results.set(index, invokeSafely(calls.get(index), group.token(index)));
                        report(index, reported, completed);
                    }
                }, workerExecutor);
                for (int index = first; index < end; index++) {
                    group.token(index).bind(future);
                }
                // a cancelled or broken chain still settles every call it had not reached
                future.whenComplete((ignored, error) -> {
                    for (int index = first; index < end; index++) {
                        report(index, reported, completed);
                    }
                });
            }

            try {
                for (int settled = 0; settled < calls.size(); settled++) {
                    Integer index = completed.poll(CANCEL_POLL_MILLIS, TimeUnit.MILLISECONDS);
                    while (index == null) {
                        if (ctx.isCancelled() && !group.anyCancelled()) {
                            log.info("Run for mode {} cancelled mid-round; abandoning pending calls.",
                                    spec.mode().id());
                            group.cancelAll();
                        }
                        index = completed.poll(CANCEL_POLL_MILLIS, TimeUnit.MILLISECONDS);
                    }
                    InstanceCall call = calls.get(index);
                    StreamResult result = group.token(index).isCancelled() ? null : results.get(index);
                    ordered.set(index, result);
                    if (result != null) {
                        successes.add(new InstanceSuccess(call.instance(), result, index));
                    }
                    if (listener != null) {
                        listener.onComplete(call, result, index);
                    }
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                group.cancelAll();
                throw new IllegalStateException("Interrupted while waiting for " + spec.mode().id() + " round", ex);
            }
            log.debug("Round for mode {} settled: {}/{} calls succeeded.", spec.mode().id(), successes.size(),
                    calls.size());
            return new GatherResult(calls, ordered, successes);
        }

        @Override
        @Nullable
        public StreamResult callSingle(ModelInstance instance, List<InputItem> input) {
            return callSingle(instance, input, null);
        }

        @Override
        @Nullable
        public StreamResult callSingle(ModelInstance instance, List<InputItem> input,
                                       @Nullable ModelParameters overrides) {
            return gatherCalls(List.of(InstanceCall.of(instance, input, overrides)), null).resultAt(0);
        }

        @Override
        public void setState(S next) {
            state = next;
            ctx.publisher().setModeState(next);
        }

        @Override
        public void updateState(UnaryOperator<S> updater) {
            S next = updater.apply(state);
            state = next;
            ctx.publisher().updateModeState(current -> current.mode() == next.mode() ? next : current);
        }

        @Override
        public List<InputItem> buildConversationInput(String modelId, String userContent) {
            return MessageHistory.conversationInput(ctx.history(), ctx.historyMode(), modelId, userContent);
        }

        @Override
        public List<InputItem> buildHistoryInput(String modelId) {
            return MessageHistory.historyInput(ctx.history(), ctx.historyMode(), modelId);
        }

        @Override
        public boolean isCancelled() {
            return ctx.isCancelled();
        }

        private void cancelActive() {
            activeGroup.cancelAll();
        }

        @Nullable
        private StreamResult invokeSafely(InstanceCall call, CancellationToken token) {
            if (token.isCancelled()) {
                return null;
            }
            ModelInstance instance = call.instance();
            ModelParameters parameters = ctx.settings().merge(instance.parameters()).merge(call.overrides());
            metricsService.recordCall(instance.modelId(), call.streamId());
            try {
                StreamResult result = ctx.invoker().invoke(new InvocationRequest(instance.modelId(), call.input(),
                        token, parameters, call.streamId(), instance.label()));
                if (result == null) {
                    metricsService.recordFailedCall(instance.modelId());
                }
                return result;
            } catch (RuntimeException ex) {
                log.warn("Call to {} (stream {}) failed: {}", instance.modelId(), call.streamId(), ex.getMessage());
                metricsService.recordFailedCall(instance.modelId());
                return null;
            }
        }
    }

    /**
     * Claims and enqueues an index as one step, so a chain's indexes reach the caller in order.
     */
    private static void report(int index, Set<Integer> reported, BlockingQueue<Integer> completed) {
        synchronized (completed) {
            if (reported.add(index)) {
                completed.add(index);
            }
        }
    }
}
