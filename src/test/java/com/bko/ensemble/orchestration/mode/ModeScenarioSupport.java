package com.bko.ensemble.orchestration.mode;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeFallback;
import com.bko.ensemble.orchestration.runner.ModeRunner;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RecordingPublisher;
import com.bko.ensemble.orchestration.runner.ScriptedInvoker;
import com.bko.ensemble.orchestration.service.JsonProcessingService;
import com.bko.ensemble.orchestration.service.ModeMetricsService;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.ModeState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs modes end to end against a {@link ScriptedInvoker} on a real worker pool.
 */
abstract class ModeScenarioSupport {

    protected final EnsembleProperties properties = new EnsembleProperties();
    protected final ModePromptService promptService = new ModePromptService();
    protected final JsonProcessingService jsonProcessingService = new JsonProcessingService(new ObjectMapper());
    protected final ModeMetricsService metricsService = new ModeMetricsService();
    protected RecordingPublisher publisher;

    private ExecutorService executor;
    private ModeRunner runner;

    @BeforeEach
    void setUpRunner() {
        executor = Executors.newFixedThreadPool(4);
        runner = new ModeRunner(executor, metricsService);
        publisher = new RecordingPublisher();
    }

    @AfterEach
    void shutDownRunner() {
        executor.shutdownNow();
    }

    protected <S extends ModeState> List<ModeResult> run(ModeSpec<S> spec, String question,
                                                         List<ModelInstance> instances, ModeConfig config,
                                                         ScriptedInvoker invoker) {
        ModeContext ctx = ModeContext.of(instances, invoker, publisher).withConfig(config);
        return runner.run(spec, question, ctx, ModeFallback.NONE);
    }

    protected <S extends ModeState> List<ModeResult> run(ModeSpec<S> spec, String question,
                                                         List<ModelInstance> instances, ScriptedInvoker invoker) {
        return run(spec, question, instances, ModeConfig.empty(), invoker);
    }

    protected <S extends ModeState> S finalState(Class<S> type) {
        return type.cast(publisher.latest());
    }

    /** Instances {@code m1..mN} running {@code provider/model-N}. */
    protected static List<ModelInstance> instances(int count) {
        List<ModelInstance> instances = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            instances.add(ModelInstance.of("m" + i, "provider/model-" + i));
        }
        return instances;
    }

    protected static long nonNull(List<ModeResult> results) {
        return results.stream().filter(result -> result != null).count();
    }
}
