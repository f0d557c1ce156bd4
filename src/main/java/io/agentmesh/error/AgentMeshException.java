package io.agentmesh.error;

public abstract class AgentMeshException extends RuntimeException {
    private final ErrorKind kind;

    protected AgentMeshException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AgentMeshException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind.retryable();
    }
}
