package io.agentmesh.error;

public final class InvalidPlanException extends AgentMeshException {
    public InvalidPlanException(String message) {
        super(ErrorKind.INVALID_PLAN, message);
    }
}
