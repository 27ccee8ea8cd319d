package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.*;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.InstanceCall;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.JsonProcessingService;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.HierarchicalState;
import com.bko.ensemble.orchestration.state.HierarchicalState.Subtask;
import com.bko.ensemble.orchestration.state.HierarchicalState.WorkerResult;
import com.bko.ensemble.orchestration.support.ModelNames;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The coordinator splits the request into subtasks, workers execute them and the coordinator combines the
 * results. Workers run concurrently with each other; a worker holding several subtasks works through them in order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HierarchicalMode implements ModeSpec<HierarchicalState> {

    private final ModePromptService promptService;
    private final JsonProcessingService jsonProcessingService;

    @Override
    public ConversationMode mode() {
        return ConversationMode.HIERARCHICAL;
    }

    @Override
    public int minInstances() {
        return 2;
    }

    @Override
    public boolean validate(ModeContext ctx) {
        return !workers(ctx).isEmpty();
    }

    @Override
    public HierarchicalState initialize(ModeContext ctx) {
        ModelInstance coordinator = coordinator(ctx);
        return new HierarchicalState(HierarchicalState.Phase.DECOMPOSING, coordinator.modelId(), coordinator.id(),
                List.of(), List.of(), null, null, null);
    }

    @Override
    public HierarchicalState execute(ModeContext ctx, RunnerHelpers<HierarchicalState> helpers) {
        ModelInstance coordinator = coordinator(ctx);
        List<ModelInstance> workers = workers(ctx);
        String question = ctx.userContent();

        List<InputItem> decompositionInput = new ArrayList<>(helpers.buildHistoryInput(coordinator.modelId()));
        decompositionInput.add(InputItem.system(promptService.decompositionPrompt(ctx.config(), question,
                workers.stream().map(worker -> ModelNames.shortName(worker.modelId())).toList())));
        decompositionInput.add(InputItem.user(question));
        StreamResult decomposition = helpers.callSingle(coordinator, decompositionInput);

        List<Subtask> subtasks = null;
        if (decomposition != null) {
            subtasks = parseSubtasks(jsonProcessingService.parseJsonResponse("subtask decomposition",
                    decomposition.content(), SubtaskPlan.class), workers);
        }
        if (subtasks == null) {
            log.warn("Decomposition unusable; assigning one generic subtask per worker.");
            subtasks = genericSubtasks(workers, question);
        }
        log.info("Coordinator {} planned {} subtask(s) for {} worker(s).", coordinator.id(), subtasks.size(),
                workers.size());
        helpers.setState(helpers.state()
                .withPhase(HierarchicalState.Phase.EXECUTING)
                .withSubtasks(subtasks)
                .withDecompositionUsage(decomposition != null ? decomposition.usage() : null));

        executeSubtasks(ctx, helpers, workerQueues(subtasks));

        List<WorkerResult> results = helpers.state().workerResults();
        if (results.isEmpty()) {
            log.warn("Every subtask failed; nothing to synthesize.");
            return helpers.state().withPhase(HierarchicalState.Phase.DONE).withSynthesis(HIERARCHICAL_NO_RESULTS);
        }

        helpers.setState(helpers.state().withPhase(HierarchicalState.Phase.SYNTHESIZING));
        String formatted = formatWorkerResults(results);
        StreamResult synthesis = helpers.callSingle(coordinator, List.of(
                InputItem.system(promptService.hierarchicalSynthesisPrompt(question, formatted)),
                InputItem.user(HIERARCHICAL_SYNTHESIS_INSTRUCTION)));
        if (synthesis == null) {
            log.warn("Coordinator synthesis failed; returning the raw worker results.");
            return helpers.state()
                    .withPhase(HierarchicalState.Phase.DONE)
                    .withSynthesis(HIERARCHICAL_SYNTHESIS_FALLBACK + formatted);
        }
        return helpers.state()
                .withPhase(HierarchicalState.Phase.DONE)
                .withSynthesis(synthesis.content())
                .withSynthesisUsage(synthesis.usage());
    }

    @Override
    public List<ModeResult> finalize(HierarchicalState state, ModeContext ctx) {
        if (state.workerResults().isEmpty() || state.synthesis() == null) {
            return ModeResults.empty(ctx.instances());
        }
        MessageUsage total = UsageAggregator.aggregate(state.workerResults(), state.decompositionUsage(),
                state.synthesisUsage());
        ModeMetadata metadata = new ModeMetadata(mode(), ResultKind.SYNTHESIS,
                ModelNames.shortName(state.coordinatorModel()), state, total);
        return ModeResults.at(ctx.instances(), state.coordinatorInstanceId(),
                new ModeResult(state.synthesis(), state.synthesisUsage(), metadata));
    }

    private void executeSubtasks(ModeContext ctx, RunnerHelpers<HierarchicalState> helpers,
                                 List<List<Subtask>> queues) {
        HierarchicalState state = helpers.state();
        for (List<Subtask> queue : queues) {
            state = state.withSubtaskStatus(queue.get(0).id(), Subtask.Status.IN_PROGRESS, null);
        }
        helpers.setState(state);

        List<Subtask> flattened = queues.stream().flatMap(List::stream).toList();
        List<List<InstanceCall>> chains = queues.stream()
                .map(queue -> queue.stream()
                        .map(subtask -> InstanceCall.of(instanceById(ctx, subtask.assignedInstanceId()), List.of(
                                InputItem.system(promptService.workerPrompt(ctx.config(), subtask.description(),
                                        ctx.userContent())),
                                InputItem.user(WORKER_INSTRUCTION))))
                        .toList())
                .toList();
        helpers.gatherChains(chains, (call, result, index) -> {
            Subtask subtask = flattened.get(index);
            Subtask next = index + 1 < flattened.size()
                    && flattened.get(index + 1).assignedInstanceId().equals(subtask.assignedInstanceId())
                    ? flattened.get(index + 1) : null;
            if (result == null) {
                helpers.updateState(current -> started(current.withSubtaskStatus(subtask.id(),
                        Subtask.Status.FAILED, null), next));
                return;
            }
            WorkerResult workerResult = new WorkerResult(subtask.id(), call.instance().id(),
                    call.instance().displayName(), subtask.description(), result.content(), result.usage());
            helpers.updateState(current -> started(current
                    .withSubtaskStatus(subtask.id(), Subtask.Status.COMPLETE, result.content())
                    .withWorkerResult(workerResult), next));
        });
    }

    private static HierarchicalState started(HierarchicalState state, @Nullable Subtask next) {
        return next == null ? state : state.withSubtaskStatus(next.id(), Subtask.Status.IN_PROGRESS, null);
    }

    /**
     * One queue per worker, in plan order. Workers appear in the order of their first subtask.
     */
    static List<List<Subtask>> workerQueues(List<Subtask> subtasks) {
        Map<String, List<Subtask>> byWorker = subtasks.stream()
                .collect(Collectors.groupingBy(Subtask::assignedInstanceId, LinkedHashMap::new, Collectors.toList()));
        return new ArrayList<>(byWorker.values());
    }

    /**
     * Subtasks without a description are dropped. Returns {@code null} when nothing usable remains.
     */
    @Nullable
    static List<Subtask> parseSubtasks(@Nullable SubtaskPlan plan, List<ModelInstance> workers) {
        if (plan == null || plan.subtasks() == null) {
            return null;
        }
        List<PlannedSubtask> planned = plan.subtasks().stream()
                .filter(subtask -> subtask != null && StringUtils.hasText(subtask.description()))
                .toList();
        List<Subtask> subtasks = new ArrayList<>();
        for (int i = 0; i < planned.size(); i++) {
            PlannedSubtask item = planned.get(i);
            ModelInstance worker = assign(item.assignedModel(), workers).orElse(workers.get(i % workers.size()));
            String id = StringUtils.hasText(item.id()) ? item.id() : SUBTASK_ID_PREFIX + (i + 1);
            subtasks.add(new Subtask(id, item.description(), worker.displayName(), worker.id(),
                    Subtask.Status.PENDING, null));
        }
        return subtasks.isEmpty() ? null : subtasks;
    }

    /**
     * Exact instance id, then exact model id, then a substring match either way against the short model name.
     */
    static Optional<ModelInstance> assign(@Nullable String assignedModel, List<ModelInstance> workers) {
        if (!StringUtils.hasText(assignedModel)) {
            return Optional.empty();
        }
        return workers.stream()
                .filter(worker -> worker.id().equals(assignedModel))
                .findFirst()
                .or(() -> workers.stream().filter(worker -> worker.modelId().equals(assignedModel)).findFirst())
                .or(() -> workers.stream()
                        .filter(worker -> {
                            String shortName = ModelNames.shortName(worker.modelId());
                            return assignedModel.contains(shortName) || shortName.contains(assignedModel);
                        })
                        .findFirst());
    }

    static List<Subtask> genericSubtasks(List<ModelInstance> workers, String question) {
        List<Subtask> subtasks = new ArrayList<>();
        for (int i = 0; i < workers.size(); i++) {
            ModelInstance worker = workers.get(i);
            subtasks.add(new Subtask(SUBTASK_ID_PREFIX + (i + 1), GENERIC_SUBTASK_PREFIX + question,
                    worker.displayName(), worker.id(), Subtask.Status.PENDING, null));
        }
        return subtasks;
    }

    static String formatWorkerResults(List<WorkerResult> results) {
        return results.stream()
                .map(result -> "### Subtask: " + result.subtaskId()
                        + "\n**Model:** " + ModelNames.shortName(result.model())
                        + "\n**Task:** " + result.description()
                        + "\n\n**Result:**\n" + result.content())
                .collect(Collectors.joining(RESPONSE_SEPARATOR));
    }

    private ModelInstance instanceById(ModeContext ctx, String instanceId) {
        return ctx.instances().stream()
                .filter(instance -> instance.id().equals(instanceId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Worker instance not found: " + instanceId));
    }

    private List<ModelInstance> workers(ModeContext ctx) {
        return SynthesizedMode.responders(ctx.instances(), coordinator(ctx));
    }

    private ModelInstance coordinator(ModeContext ctx) {
        ModeConfig config = ctx.config();
        return ModelNames.findSpecialInstance(ctx.instances(), config.coordinatorInstanceId(),
                        config.coordinatorModel())
                .orElseThrow(() -> new IllegalStateException("Coordinator instance not found"));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubtaskPlan(@Nullable List<PlannedSubtask> subtasks) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlannedSubtask(@Nullable String id, @Nullable String description, @Nullable String assignedModel) {
    }
}
