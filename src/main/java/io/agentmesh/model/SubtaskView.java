package io.agentmesh.model;

import java.util.List;

public record SubtaskView(
        String id,
        String description,
        Capability requiredCapability,
        String assignedAgentId,
        List<String> dependencies,
        SubtaskStatus status,
        String result,
        String error
) {
    public SubtaskView {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
