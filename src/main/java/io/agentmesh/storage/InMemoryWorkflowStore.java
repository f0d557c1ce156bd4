package io.agentmesh.storage;

import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowSummary;
import io.agentmesh.model.WorkflowView;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process history. When full, the oldest finished workflow is evicted first;
 * a running workflow is only evicted when nothing finished is left.
 */
public final class InMemoryWorkflowStore implements WorkflowStore {
    private final int capacity;
    private final Map<String, WorkflowView> workflows = new LinkedHashMap<>();

    public InMemoryWorkflowStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void save(WorkflowView workflow) {
        workflows.put(workflow.id(), workflow);
        while (workflows.size() > capacity) {
            evictOne(workflow.id());
        }
    }

    @Override
    public synchronized Optional<WorkflowView> find(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public synchronized List<WorkflowSummary> list(WorkflowStatus statusFilter) {
        List<WorkflowView> views = new ArrayList<>(workflows.values());
        List<WorkflowSummary> out = new ArrayList<>(views.size());
        for (int i = views.size() - 1; i >= 0; i--) {
            WorkflowView view = views.get(i);
            if (statusFilter == null || view.status() == statusFilter) {
                out.add(view.summary());
            }
        }
        out.sort(Comparator.comparingLong(WorkflowSummary::createdAtMs).reversed());
        return out;
    }

    public synchronized int size() {
        return workflows.size();
    }

    private void evictOne(String keepId) {
        Iterator<WorkflowView> it = workflows.values().iterator();
        while (it.hasNext()) {
            WorkflowView candidate = it.next();
            if (candidate.status().finished() && !candidate.id().equals(keepId)) {
                it.remove();
                return;
            }
        }
        it = workflows.values().iterator();
        while (it.hasNext()) {
            if (!it.next().id().equals(keepId)) {
                it.remove();
                return;
            }
        }
    }
}
