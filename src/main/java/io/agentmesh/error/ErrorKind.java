package io.agentmesh.error;

public enum ErrorKind {
    AGENT_UNAVAILABLE(true),
    TIMEOUT(true),
    INVALID_TRANSITION(false),
    INVALID_PLAN(false),
    NO_AGENT_AVAILABLE(false),
    APPLICATION_ERROR(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
