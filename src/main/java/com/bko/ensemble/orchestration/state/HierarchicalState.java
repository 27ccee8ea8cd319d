package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.UsageCarrier;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;

@With
@JsonTypeName("hierarchical")
public record HierarchicalState(
        Phase phase,
        String coordinatorModel,
        String coordinatorInstanceId,
        List<Subtask> subtasks,
        List<WorkerResult> workerResults,
        @Nullable String synthesis,
        @Nullable MessageUsage decompositionUsage,
        @Nullable MessageUsage synthesisUsage
) implements ModeState {

    public HierarchicalState {
        subtasks = List.copyOf(subtasks);
        workerResults = List.copyOf(workerResults);
    }

    @Override
    public ConversationMode mode() {
        return ConversationMode.HIERARCHICAL;
    }

    @Override
    public String phaseName() {
        return phase.value();
    }

    public HierarchicalState withSubtaskStatus(String subtaskId, Subtask.Status status, @Nullable String result) {
        List<Subtask> updated = subtasks.stream()
                .map(subtask -> subtask.id().equals(subtaskId) ? subtask.withStatus(status).withResult(result) : subtask)
                .toList();
        return withSubtasks(updated);
    }

    public HierarchicalState withWorkerResult(WorkerResult result) {
        return withWorkerResults(StateLists.append(workerResults, result));
    }

    @With
    public record Subtask(
            String id,
            String description,
            String assignedModel,
            String assignedInstanceId,
            Status status,
            @Nullable String result
    ) {

        public enum Status {
            PENDING, IN_PROGRESS, COMPLETE, FAILED;

            @JsonValue
            public String value() {
                return name().toLowerCase(Locale.ROOT);
            }
        }
    }

    public record WorkerResult(
            String subtaskId,
            String instanceId,
            String model,
            String description,
            String content,
            @Nullable MessageUsage usage
    ) implements UsageCarrier {
    }

    public enum Phase {
        DECOMPOSING, EXECUTING, SYNTHESIZING, DONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
