package io.agentmesh.orchestrator;

import io.agentmesh.model.Capability;
import io.agentmesh.model.SubtaskStatus;
import io.agentmesh.model.SubtaskView;

import java.util.List;

/**
 * Mutable subtask owned by its {@link Workflow}. Status moves only through the workflow.
 */
public final class Subtask {
    private final String id;
    private final String description;
    private final Capability requiredCapability;
    private final List<String> dependencies;
    private SubtaskStatus status = SubtaskStatus.PENDING;
    private String assignedAgentId;
    private String result;
    private String error;

    Subtask(SubtaskSpec spec) {
        this.id = spec.id();
        this.description = spec.description();
        this.requiredCapability = spec.requiredCapability();
        this.dependencies = spec.dependencies();
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public Capability requiredCapability() {
        return requiredCapability;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public SubtaskStatus status() {
        return status;
    }

    public String assignedAgentId() {
        return assignedAgentId;
    }

    public String result() {
        return result;
    }

    public String error() {
        return error;
    }

    void status(SubtaskStatus status) {
        this.status = status;
    }

    void assignedAgentId(String agentId) {
        this.assignedAgentId = agentId;
    }

    void result(String result) {
        this.result = result;
    }

    void error(String error) {
        this.error = error;
    }

    SubtaskView toView() {
        return new SubtaskView(id, description, requiredCapability, assignedAgentId, dependencies, status, result, error);
    }
}
