package io.agentmesh.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Category {
    DIRECT("direct"),
    DELEGATE("delegate"),
    MULTI_STEP("multi_step");

    private final String wire;

    Category(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static Category fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Category cannot be empty");
        }
        for (Category value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wire.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + raw);
    }
}
