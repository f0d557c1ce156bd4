package io.agentmesh.orchestrator;

import io.agentmesh.model.Capability;

import java.util.List;

public record SubtaskSpec(String id, String description, Capability requiredCapability, List<String> dependencies) {
    public SubtaskSpec {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static SubtaskSpec of(String id, String description, Capability capability, String... dependencies) {
        return new SubtaskSpec(id, description, capability, List.of(dependencies));
    }
}
