package io.agentmesh.storage;

import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowSummary;
import io.agentmesh.model.WorkflowView;

import java.util.List;
import java.util.Optional;

/**
 * History of workflows. Writers are serialized by the implementation; readers get
 * immutable snapshots, so repeated reads of an unchanged workflow return equal data.
 */
public interface WorkflowStore extends AutoCloseable {
    void save(WorkflowView workflow);

    Optional<WorkflowView> find(String workflowId);

    /**
     * @param statusFilter null for every status
     * @return most recent first
     */
    List<WorkflowSummary> list(WorkflowStatus statusFilter);

    @Override
    default void close() {
    }
}
