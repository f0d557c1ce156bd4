package io.agentmesh.orchestrator;

import io.agentmesh.model.SubtaskStatus;
import io.agentmesh.model.SubtaskView;
import io.agentmesh.model.WorkflowEvent;
import io.agentmesh.model.WorkflowEventType;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowView;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Live workflow state. Confined to the thread running it; everything else sees
 * {@link WorkflowView} snapshots.
 *
 * <p>A subtask becomes {@code ready} only once every dependency is {@code completed}. A
 * failed subtask takes all of its transitive dependents to {@code skipped}.
 */
public final class Workflow {
    static final String CANCELLED = "cancelled";

    private final String id;
    private final String originalRequest;
    private final long createdAtMs;
    private final Clock clock;
    private final Map<String, Subtask> subtasks = new LinkedHashMap<>();
    private final List<WorkflowEvent> history = new ArrayList<>();
    private WorkflowStatus status = WorkflowStatus.PLANNING;
    private Long completedAtMs;

    Workflow(String originalRequest, List<SubtaskSpec> specs, Clock clock) {
        this.id = "wf_" + UUID.randomUUID();
        this.originalRequest = originalRequest;
        this.clock = clock;
        this.createdAtMs = clock.millis();
        for (SubtaskSpec spec : specs) {
            subtasks.put(spec.id(), new Subtask(spec));
        }
    }

    public String id() {
        return id;
    }

    public String originalRequest() {
        return originalRequest;
    }

    public WorkflowStatus status() {
        return status;
    }

    public List<Subtask> subtasks() {
        return List.copyOf(subtasks.values());
    }

    public Optional<Subtask> subtask(String subtaskId) {
        return Optional.ofNullable(subtasks.get(subtaskId));
    }

    void start() {
        status = WorkflowStatus.RUNNING;
    }

    /**
     * Moves every pending subtask whose dependencies are all completed to ready.
     *
     * @return the newly ready subtasks, in plan order
     */
    List<Subtask> promoteReady() {
        List<Subtask> ready = new ArrayList<>();
        for (Subtask subtask : subtasks.values()) {
            if (subtask.status() != SubtaskStatus.PENDING) {
                continue;
            }
            boolean satisfied = true;
            for (String dep : subtask.dependencies()) {
                if (subtasks.get(dep).status() != SubtaskStatus.COMPLETED) {
                    satisfied = false;
                    break;
                }
            }
            if (satisfied) {
                subtask.status(SubtaskStatus.READY);
                append(subtask.id(), WorkflowEventType.READY, null, null);
                ready.add(subtask);
            }
        }
        return ready;
    }

    void markRunning(Subtask subtask, String agentId) {
        subtask.assignedAgentId(agentId);
        subtask.status(SubtaskStatus.RUNNING);
        append(subtask.id(), WorkflowEventType.STARTED, agentId, null);
    }

    void markCompleted(Subtask subtask, String agentId, String result) {
        subtask.assignedAgentId(agentId);
        subtask.result(result);
        subtask.status(SubtaskStatus.COMPLETED);
        append(subtask.id(), WorkflowEventType.COMPLETED, agentId, null);
    }

    void markFailed(Subtask subtask, String agentId, String error) {
        if (agentId != null) {
            subtask.assignedAgentId(agentId);
        }
        subtask.error(error);
        subtask.status(SubtaskStatus.FAILED);
        append(subtask.id(), WorkflowEventType.FAILED, agentId, error);
        skipDependentsOf(subtask.id());
    }

    private void skipDependentsOf(String failedId) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Subtask candidate : subtasks.values()) {
                if (candidate.status().terminal() || candidate.status() == SubtaskStatus.RUNNING) {
                    continue;
                }
                for (String dep : candidate.dependencies()) {
                    SubtaskStatus depStatus = subtasks.get(dep).status();
                    if (depStatus == SubtaskStatus.FAILED || depStatus == SubtaskStatus.SKIPPED) {
                        String reason = "dependency " + dep + " " + depStatus.wire();
                        candidate.error(reason);
                        candidate.status(SubtaskStatus.SKIPPED);
                        append(candidate.id(), WorkflowEventType.SKIPPED, null, reason);
                        changed = true;
                        break;
                    }
                }
            }
        }
    }

    /**
     * Skips every subtask that has not been dispatched yet.
     *
     * @return number of subtasks skipped
     */
    int cancelRemaining() {
        int skipped = 0;
        for (Subtask subtask : subtasks.values()) {
            if (subtask.status() == SubtaskStatus.PENDING || subtask.status() == SubtaskStatus.READY) {
                subtask.error(CANCELLED);
                subtask.status(SubtaskStatus.SKIPPED);
                append(subtask.id(), WorkflowEventType.SKIPPED, null, CANCELLED);
                skipped++;
            }
        }
        return skipped;
    }

    /**
     * Settles the final status: completed when every subtask completed, failed when none
     * did, partial otherwise.
     */
    void finish() {
        int completed = 0;
        for (Subtask subtask : subtasks.values()) {
            if (subtask.status() == SubtaskStatus.COMPLETED) {
                completed++;
            }
        }
        if (completed == subtasks.size()) {
            status = WorkflowStatus.COMPLETED;
        } else if (completed == 0) {
            status = WorkflowStatus.FAILED;
        } else {
            status = WorkflowStatus.PARTIAL;
        }
        completedAtMs = clock.millis();
    }

    public WorkflowView toView() {
        List<SubtaskView> views = new ArrayList<>(subtasks.size());
        for (Subtask subtask : subtasks.values()) {
            views.add(subtask.toView());
        }
        return new WorkflowView(id, originalRequest, status, createdAtMs, completedAtMs, views, history);
    }

    private void append(String subtaskId, WorkflowEventType type, String agentId, String detail) {
        history.add(new WorkflowEvent(history.size() + 1, subtaskId, type, agentId, detail, clock.millis()));
    }
}
