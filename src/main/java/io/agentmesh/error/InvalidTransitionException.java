package io.agentmesh.error;

import io.agentmesh.model.AgentState;

public final class InvalidTransitionException extends AgentMeshException {
    private final AgentState from;
    private final AgentState to;

    public InvalidTransitionException(String agentId, AgentState from, AgentState to) {
        super(ErrorKind.INVALID_TRANSITION, "Invalid state transition for " + agentId + ": " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public AgentState from() {
        return from;
    }

    public AgentState to() {
        return to;
    }
}
