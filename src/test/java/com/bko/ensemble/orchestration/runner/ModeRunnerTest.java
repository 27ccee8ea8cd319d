package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.mode.MultipleMode;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.HistoryMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.service.ModeMetricsService;
import com.bko.ensemble.orchestration.state.MultipleState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ModeRunnerTest {

    private final ModeMetricsService metricsService = new ModeMetricsService();
    private ExecutorService executor;
    private ModeRunner runner;
    private RecordingPublisher publisher;

    private final List<ModelInstance> instances = List.of(
            ModelInstance.of("a", "openai/gpt-4o"),
            ModelInstance.of("b", "anthropic/claude"),
            ModelInstance.of("c", "google/gemini"));

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        runner = new ModeRunner(executor, metricsService);
        publisher = new RecordingPublisher();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testResultsStayPositionalWhenACallFails() {
        ScriptedInvoker invoker = new ScriptedInvoker(request ->
                request.modelId().equals("anthropic/claude") ? null : "answer from " + request.modelId());

        List<ModeResult> results = runner.run(new MultipleMode(), "hello", ModeContext.of(instances, invoker, publisher),
                ModeFallback.NONE);

        assertEquals(3, results.size());
        assertEquals("answer from openai/gpt-4o", results.get(0).content());
        assertNull(results.get(1));
        assertEquals("answer from google/gemini", results.get(2).content());
        assertEquals(ResultKind.DIRECT, results.get(0).metadata().kind());
        assertEquals(1, metricsService.failedCallCount());
        assertEquals(List.of(List.of("a", "b", "c")), publisher.streamRounds());
        assertEquals("done", publisher.latest().phaseName());
    }

    @Test
    void testThrowingInvokerCountsAsFailedCall() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> {
            if (request.modelId().equals("openai/gpt-4o")) {
                throw new IllegalStateException("provider down");
            }
            return "ok";
        });

        List<ModeResult> results = runner.run(new MultipleMode(), "hello", ModeContext.of(instances, invoker, publisher),
                ModeFallback.NONE);

        assertNull(results.get(0));
        assertNotNull(results.get(1));
        assertNotNull(results.get(2));
    }

    @Test
    void testFallbackWhenBelowMinimumInstances() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "unused");
        List<String> fallbackMessages = new ArrayList<>();
        ModeFallback fallback = userContent -> {
            fallbackMessages.add(userContent);
            return List.of();
        };

        List<ModeResult> results = runner.run(new FixedSpec(5), "question", ModeContext.of(instances, invoker, publisher),
                fallback);

        assertTrue(results.isEmpty());
        assertEquals(List.of("question"), fallbackMessages);
        assertTrue(invoker.requests().isEmpty());
        assertNull(publisher.latest());
        assertEquals(1, metricsService.fallbackCount());
    }

    @Test
    void testFailedValidationFallsBack() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "unused");
        FixedSpec spec = new FixedSpec(1) {
            @Override
            public boolean validate(ModeContext ctx) {
                return false;
            }
        };
        AtomicBoolean fellBack = new AtomicBoolean();

        runner.run(spec, "question", ModeContext.of(instances, invoker, publisher), userContent -> {
            fellBack.set(true);
            return List.of();
        });

        assertTrue(fellBack.get());
        assertTrue(invoker.requests().isEmpty());
    }

    @Test
    void testListenersRunOnTheCallingThread() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "ok");
        Thread caller = Thread.currentThread();
        List<Thread> listenerThreads = new CopyOnWriteArrayList<>();
        FixedSpec spec = new FixedSpec(1) {
            @Override
            public MultipleState execute(ModeContext ctx, RunnerHelpers<MultipleState> helpers) {
                helpers.gather(helpers.instances(), instance -> helpers.buildConversationInput(instance.modelId(),
                        ctx.userContent()), (call, result, index) -> listenerThreads.add(Thread.currentThread()));
                return helpers.state();
            }
        };

        runner.run(spec, "question", ModeContext.of(instances, invoker, publisher), ModeFallback.NONE);

        assertEquals(3, listenerThreads.size());
        listenerThreads.forEach(thread -> assertSame(caller, thread));
    }

    @Test
    void testChainsRunInOrderAndStayPositional() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> {
            String message = ScriptedInvoker.lastUserMessage(request);
            return message.equals("a-2") ? null : "done " + message;
        });
        AtomicReference<GatherResult> gathered = new AtomicReference<>();
        List<Integer> listenerIndexes = new CopyOnWriteArrayList<>();
        FixedSpec spec = new FixedSpec(1) {
            @Override
            public MultipleState execute(ModeContext ctx, RunnerHelpers<MultipleState> helpers) {
                ModelInstance a = instances.get(0);
                ModelInstance b = instances.get(1);
                gathered.set(helpers.gatherChains(List.of(
                        List.of(InstanceCall.of(a, List.of(InputItem.user("a-1"))),
                                InstanceCall.of(a, List.of(InputItem.user("a-2")))),
                        List.of(InstanceCall.of(b, List.of(InputItem.user("b-1"))))),
                        (call, result, index) -> listenerIndexes.add(index)));
                return helpers.state();
            }
        };

        runner.run(spec, "question", ModeContext.of(instances, invoker, publisher), ModeFallback.NONE);

        GatherResult result = gathered.get();
        assertEquals(3, result.orderedResults().size());
        assertEquals("done a-1", result.resultAt(0).content());
        assertNull(result.resultAt(1));
        assertEquals("done b-1", result.resultAt(2).content());
        assertEquals(2, result.successCount());
        assertEquals(3, listenerIndexes.size());
        assertTrue(listenerIndexes.containsAll(List.of(0, 1, 2)));
        List<String> aMessages = invoker.requestsTo("openai/gpt-4o").stream()
                .map(ScriptedInvoker::lastUserMessage)
                .toList();
        assertEquals(List.of("a-1", "a-2"), aMessages);
        assertEquals(List.of("a", "b"), publisher.streamRounds().get(publisher.streamRounds().size() - 1));
    }

    @Test
    void testExecuteFailurePropagates() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "ok");
        FixedSpec spec = new FixedSpec(1) {
            @Override
            public MultipleState execute(ModeContext ctx, RunnerHelpers<MultipleState> helpers) {
                throw new IllegalStateException("broken mode");
            }
        };

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> runner.run(spec, "question", ModeContext.of(instances, invoker, publisher), ModeFallback.NONE));
        assertEquals("broken mode", ex.getMessage());
    }

    @Test
    void testCancelledRunSkipsCalls() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "ok");
        ModeContext ctx = new ModeContext(instances, List.of(), HistoryMode.ALL, null, null, invoker, publisher,
                () -> true, null);

        List<ModeResult> results = runner.run(new MultipleMode(), "hello", ctx, ModeFallback.NONE);

        assertTrue(invoker.requests().isEmpty());
        results.forEach(result -> assertNull(result));
    }

    @Test
    void testCancellationMidRoundAbandonsPendingCalls() throws InterruptedException {
        CountDownLatch slowStarted = new CountDownLatch(1);
        AtomicBoolean cancelled = new AtomicBoolean();
        ScriptedInvoker invoker = new ScriptedInvoker(request -> {
            if (request.modelId().equals("google/gemini")) {
                slowStarted.countDown();
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (!request.token().isCancelled() && System.nanoTime() < deadline) {
                    Thread.onSpinWait();
                }
                return request.token().isCancelled() ? null : "too late";
            }
            return "fast";
        });
        ModeContext ctx = new ModeContext(instances, List.of(), HistoryMode.ALL, null, null, invoker, publisher,
                cancelled::get, null);

        Thread canceller = new Thread(() -> {
            try {
                slowStarted.await();
                cancelled.set(true);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();
        long started = System.nanoTime();
        List<ModeResult> results = runner.run(new MultipleMode(), "hello", ctx, ModeFallback.NONE);
        canceller.join();

        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 5);
        assertNull(results.get(2));
    }

    @Test
    void testParametersMergeSettingsInstanceAndCallOverrides() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "ok");
        ModelInstance tuned = new ModelInstance("tuned", "openai/gpt-4o", null, ModelParameters.ofMaxTokens(100));
        FixedSpec spec = new FixedSpec(1) {
            @Override
            public MultipleState execute(ModeContext ctx, RunnerHelpers<MultipleState> helpers) {
                helpers.callSingle(tuned, helpers.buildConversationInput(tuned.modelId(), ctx.userContent()),
                        ModelParameters.ofTemperature(0.9));
                return helpers.state();
            }
        };
        ModeContext ctx = new ModeContext(List.of(tuned), List.of(), HistoryMode.ALL,
                new ModelParameters(0.3, 0.95, null, 50, null, null), ModeConfig.empty(), invoker, publisher, null,
                null);

        runner.run(spec, "question", ctx, ModeFallback.NONE);

        ModelParameters sent = invoker.requests().get(0).parameters();
        assertEquals(0.9, sent.temperature());
        assertEquals(0.95, sent.topP());
        assertEquals(100, sent.maxTokens());
    }

    private static class FixedSpec implements ModeSpec<MultipleState> {

        private final int minInstances;

        FixedSpec(int minInstances) {
            this.minInstances = minInstances;
        }

        @Override
        public ConversationMode mode() {
            return ConversationMode.MULTIPLE;
        }

        @Override
        public int minInstances() {
            return minInstances;
        }

        @Override
        public MultipleState initialize(ModeContext ctx) {
            return new MultipleState(MultipleState.Phase.RESPONDING, List.of());
        }

        @Override
        public MultipleState execute(ModeContext ctx, RunnerHelpers<MultipleState> helpers) {
            return helpers.state().withPhase(MultipleState.Phase.DONE);
        }

        @Override
        public List<ModeResult> finalize(MultipleState state, ModeContext ctx) {
            return List.of();
        }
    }
}
