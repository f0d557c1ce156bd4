package io.agentmesh.orchestrator;

import io.agentmesh.model.SubtaskStatus;
import io.agentmesh.model.SubtaskView;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a caller gets back from {@link Orchestrator#run}: results of completed subtasks,
 * the subtasks that did not complete with their reasons, and a consolidated text.
 * {@code workflowId} is null when the plan was rejected before a workflow existed.
 * {@code problems} entries without a subtask id describe the workflow as a whole.
 */
public record WorkflowReport(
        String workflowId,
        WorkflowStatus status,
        Map<String, String> results,
        List<Problem> problems,
        String summary
) {
    public WorkflowReport {
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public static WorkflowReport from(WorkflowView view) {
        Map<String, String> results = new LinkedHashMap<>();
        List<Problem> problems = new ArrayList<>();
        for (SubtaskView subtask : view.subtasks()) {
            if (subtask.status() == SubtaskStatus.COMPLETED) {
                results.put(subtask.id(), subtask.result());
            } else {
                problems.add(new Problem(subtask.id(), subtask.status(), subtask.error()));
            }
        }
        return new WorkflowReport(view.id(), view.status(), results, problems, summarize(view, results, problems));
    }

    public static WorkflowReport rejected(String reason) {
        List<Problem> problems = List.of(new Problem(null, SubtaskStatus.FAILED, reason));
        return new WorkflowReport(null, WorkflowStatus.FAILED, Map.of(), problems, "Plan rejected: " + reason);
    }

    /**
     * A workflow that stopped on an infrastructure failure, such as the history store.
     */
    public static WorkflowReport aborted(String workflowId, String reason) {
        List<Problem> problems = List.of(new Problem(null, SubtaskStatus.FAILED, reason));
        return new WorkflowReport(workflowId, WorkflowStatus.FAILED, Map.of(), problems,
                "Workflow " + workflowId + " aborted: " + reason);
    }

    public boolean completed() {
        return status == WorkflowStatus.COMPLETED;
    }

    private static String summarize(WorkflowView view, Map<String, String> results, List<Problem> problems) {
        if (view.status() == WorkflowStatus.COMPLETED && results.size() == 1) {
            return results.values().iterator().next();
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Workflow ").append(view.id()).append(' ').append(view.status().wire())
                .append(": ").append(results.size()).append('/').append(view.subtasks().size())
                .append(" subtasks completed.");
        for (Map.Entry<String, String> entry : results.entrySet()) {
            sb.append("\n[").append(entry.getKey()).append("] ").append(entry.getValue());
        }
        for (Problem problem : problems) {
            sb.append("\n[").append(problem.subtaskId()).append("] ").append(problem.status().wire())
                    .append(": ").append(problem.reason());
        }
        return sb.toString();
    }

    public record Problem(String subtaskId, SubtaskStatus status, String reason) {
    }
}
