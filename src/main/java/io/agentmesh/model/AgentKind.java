package io.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentKind {
    ECHO("echo"),
    CODE("code"),
    SYSTEM("system"),
    MEMORY("memory"),
    ORCHESTRATED("orchestrated"),
    GENERIC("generic");

    private final String wire;

    AgentKind(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static AgentKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return GENERIC;
        }
        for (AgentKind value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent kind: " + raw);
    }
}
