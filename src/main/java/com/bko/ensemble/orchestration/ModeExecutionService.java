package com.bko.ensemble.orchestration;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModeRunCommand;
import com.bko.ensemble.orchestration.model.ModeRunOutcome;
import com.bko.ensemble.orchestration.runner.InstanceInvoker;
import com.bko.ensemble.orchestration.runner.LatestStatePublisher;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeFallback;
import com.bko.ensemble.orchestration.runner.ModeRunner;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.ModeStatePublisher;
import com.bko.ensemble.orchestration.service.ModeMetricsService;
import com.bko.ensemble.stream.ModeStreamService;
import com.bko.ensemble.stream.StreamingInstanceInvoker;
import com.bko.ensemble.stream.StreamingModeStatePublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Entry point for running a mode, either synchronously or as a streamed run.
 */
@Service
@Slf4j
public class ModeExecutionService {

    private final Map<ConversationMode, ModeSpec<?>> specs = new EnumMap<>(ConversationMode.class);
    private final ModeRunner runner;
    private final InstanceInvoker invoker;
    private final ModeStreamService streamService;
    private final ModeMetricsService metricsService;
    private final EnsembleProperties properties;

    public ModeExecutionService(List<ModeSpec<?>> modeSpecs,
                                ModeRunner runner,
                                InstanceInvoker invoker,
                                ModeStreamService streamService,
                                ModeMetricsService metricsService,
                                EnsembleProperties properties) {
        for (ModeSpec<?> spec : modeSpecs) {
            ModeSpec<?> previous = specs.put(spec.mode(), spec);
            if (previous != null) {
                throw new IllegalStateException("Duplicate mode implementation for " + spec.mode().id());
            }
        }
        this.runner = runner;
        this.invoker = invoker;
        this.streamService = streamService;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    public Collection<ModeSpec<?>> availableModes() {
        return List.copyOf(specs.values());
    }

    public ModeRunOutcome run(ModeRunCommand command) {
        LatestStatePublisher publisher = new LatestStatePublisher();
        ModeContext ctx = context(command, invoker, publisher, () -> false);
        List<ModeResult> results = execute(command.mode(), ctx, command.message());
        return new ModeRunOutcome(command.mode(), results, publisher.latest());
    }

    /**
     * Executes a run created with {@link ModeStreamService#createRun}, reporting progress on its stream. Never
     * throws: failures end the run with an {@code error} event.
     */
    public void runStreaming(String runId, ModeRunCommand command) {
        StreamingModeStatePublisher publisher = new StreamingModeStatePublisher(streamService, runId);
        ModeContext ctx = context(command, new StreamingInstanceInvoker(invoker, streamService, runId), publisher,
                () -> streamService.isCancelled(runId));
        try {
            streamService.emitStatus(runId, "Running " + command.mode().label());
            List<ModeResult> results = execute(command.mode(), ctx, command.message());
            if (streamService.isCancelled(runId)) {
                streamService.emitRunComplete(runId, "CANCELLED");
                return;
            }
            streamService.emitResults(runId, results);
            streamService.emitRunComplete(runId, "COMPLETED");
        } catch (RuntimeException ex) {
            log.error("Streaming run {} ({}) failed: {}", runId, command.mode().id(), ex.getMessage(), ex);
            streamService.emitError(runId, ex.getMessage());
            streamService.emitRunComplete(runId, "FAILED");
        } finally {
            metricsService.logSummary();
        }
    }

    private List<ModeResult> execute(ConversationMode mode, ModeContext ctx, String message) {
        ModeSpec<?> spec = spec(mode);
        return runner.run(spec, message, ctx, fallbackFor(mode, ctx));
    }

    /**
     * Routed mode has no fallback; every other mode degrades to independent parallel answers.
     */
    private ModeFallback fallbackFor(ConversationMode mode, ModeContext ctx) {
        if (mode == ConversationMode.ROUTED || mode == ConversationMode.MULTIPLE) {
            return ModeFallback.NONE;
        }
        ModeSpec<?> multiple = spec(ConversationMode.MULTIPLE);
        return userContent -> {
            log.info("Mode {} falling back to {} for {} instance(s).", mode.id(), ConversationMode.MULTIPLE.id(),
                    ctx.instances().size());
            return runner.run(multiple, userContent, ctx, ModeFallback.NONE);
        };
    }

    private ModeSpec<?> spec(ConversationMode mode) {
        ModeSpec<?> spec = specs.get(mode);
        if (spec == null) {
            throw new IllegalArgumentException("Mode not available: " + mode.id());
        }
        return spec;
    }

    private ModeContext context(ModeRunCommand command, InstanceInvoker callInvoker,
                                ModeStatePublisher publisher,
                                BooleanSupplier cancelled) {
        return new ModeContext(new ArrayList<>(command.instances()), command.history(),
                command.historyMode() != null ? command.historyMode() : properties.getHistoryMode(),
                command.settings(), command.config(), callInvoker, publisher, cancelled, command.message());
    }
}
