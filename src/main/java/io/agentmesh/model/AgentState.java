package io.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Agent lifecycle state.
 *
 * <p>Allowed moves: idle to processing, processing to idle, processing to error,
 * error to idle. Everything else, including a move to the current state, is rejected.
 */
public enum AgentState {
    IDLE("idle"),
    PROCESSING("processing"),
    ERROR("error");

    private final String wire;

    AgentState(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean canTransitionTo(AgentState next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case IDLE -> next == PROCESSING;
            case PROCESSING -> next == IDLE || next == ERROR;
            case ERROR -> next == IDLE;
        };
    }

    @JsonCreator
    public static AgentState fromString(String raw) {
        for (AgentState value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent state: " + raw);
    }
}
