package io.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SubtaskStatus {
    PENDING("pending"),
    READY("ready"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wire;

    SubtaskStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    @JsonCreator
    public static SubtaskStatus fromString(String raw) {
        for (SubtaskStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown subtask status: " + raw);
    }
}
