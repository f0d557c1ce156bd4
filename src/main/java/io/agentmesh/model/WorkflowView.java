package io.agentmesh.model;

import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a workflow as kept by the history store. Subtasks are in plan
 * order and history is in append order.
 */
public record WorkflowView(
        String id,
        String originalRequest,
        WorkflowStatus status,
        long createdAtMs,
        Long completedAtMs,
        List<SubtaskView> subtasks,
        List<WorkflowEvent> history
) {
    public WorkflowView {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
        history = history == null ? List.of() : List.copyOf(history);
    }

    public Optional<SubtaskView> subtask(String subtaskId) {
        return subtasks.stream().filter(s -> s.id().equals(subtaskId)).findFirst();
    }

    public WorkflowSummary summary() {
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        for (SubtaskView subtask : subtasks) {
            switch (subtask.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                default -> {
                }
            }
        }
        return new WorkflowSummary(
                id,
                originalRequest,
                status,
                subtasks.size(),
                completed,
                failed,
                skipped,
                createdAtMs,
                completedAtMs
        );
    }
}
