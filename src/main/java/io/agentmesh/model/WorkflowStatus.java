package io.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowStatus {
    PLANNING("planning"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    PARTIAL("partial");

    private final String wire;

    WorkflowStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean finished() {
        return this == COMPLETED || this == FAILED || this == PARTIAL;
    }

    @JsonCreator
    public static WorkflowStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Workflow status cannot be empty");
        }
        for (WorkflowStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown workflow status: " + raw);
    }
}
