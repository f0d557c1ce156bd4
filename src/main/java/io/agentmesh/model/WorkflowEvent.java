package io.agentmesh.model;

/**
 * One entry of a workflow's append-only history. {@code sequence} starts at 1 and has no gaps.
 */
public record WorkflowEvent(
        int sequence,
        String subtaskId,
        WorkflowEventType type,
        String agentId,
        String detail,
        long atMs
) {
}
