package com.bko.ensemble.api;

import com.bko.ensemble.orchestration.ModeExecutionService;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.ModeRunCommand;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.stream.ModeStreamService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@RestController
@RequestMapping("/api/modes")
@Slf4j
public class ModeController {

    private final ModeExecutionService executionService;
    private final ModeStreamService streamService;
    private final ExecutorService orchestrationExecutor;

    public ModeController(ModeExecutionService executionService,
                          ModeStreamService streamService,
                          @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor) {
        this.executionService = executionService;
        this.streamService = streamService;
        this.orchestrationExecutor = orchestrationExecutor;
    }

    @GetMapping
    public List<ModeSummary> modes() {
        return executionService.availableModes().stream()
                .map(ModeSummary::from)
                .sorted(Comparator.comparing(summary -> ConversationMode.fromId(summary.id())))
                .toList();
    }

    @PostMapping("/run")
    public ModeRunResponse run(@Valid @RequestBody ModeRunRequest request) {
        return ModeRunResponse.from(executionService.run(toCommand(request)));
    }

    @PostMapping("/stream")
    public ModeStreamResponse stream(@Valid @RequestBody ModeRunRequest request) {
        ModeRunCommand command = toCommand(request);
        String runId = streamService.createRun(command.mode());
        streamService.emitStatus(runId, "Queued");
        CompletableFuture.runAsync(() -> executionService.runStreaming(runId, command), orchestrationExecutor);
        return new ModeStreamResponse(runId, Instant.now());
    }

    @PostMapping("/cancel/{runId}")
    public CancelRunResponse cancel(@PathVariable String runId) {
        boolean cancelled = streamService.cancelRun(runId);
        return cancelled ? CancelRunResponse.success(runId) : CancelRunResponse.notFound(runId);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException ex) {
        log.warn("Rejected mode request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of("message", String.valueOf(ex.getMessage())));
    }

    private ModeRunCommand toCommand(ModeRunRequest request) {
        ConversationMode mode;
        try {
            mode = ConversationMode.fromId(request.mode());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        Set<String> ids = new HashSet<>();
        for (ModelInstance instance : request.instances()) {
            if (!ids.add(instance.id())) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Duplicate instance id: " + instance.id());
            }
        }
        log.debug("Accepted {} request for {} instance(s).", mode.id(), request.instances().size());
        return new ModeRunCommand(mode, request.message(), request.instances(), request.history(),
                request.historyMode(), request.settings(), request.config());
    }
}
