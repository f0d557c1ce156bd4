package io.agentmesh.model;

public record WorkflowSummary(
        String id,
        String originalRequest,
        WorkflowStatus status,
        int subtaskCount,
        int completedCount,
        int failedCount,
        int skippedCount,
        long createdAtMs,
        Long completedAtMs
) {
}
