package io.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowEventType {
    READY("ready"),
    STARTED("started"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wire;

    WorkflowEventType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static WorkflowEventType fromString(String raw) {
        for (WorkflowEventType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown workflow event type: " + raw);
    }
}
