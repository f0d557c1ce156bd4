package io.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    REQUEST("request"),
    RESPONSE("response"),
    NOTIFICATION("notification"),
    STATUS("status"),
    ERROR("error");

    private final String wire;

    MessageType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return REQUEST;
        }
        for (MessageType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}
