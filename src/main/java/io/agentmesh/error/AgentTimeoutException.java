package io.agentmesh.error;

public final class AgentTimeoutException extends AgentMeshException {
    private final String agentId;
    private final String messageId;
    private final long timeoutMs;

    public AgentTimeoutException(String agentId, String messageId, long timeoutMs) {
        super(ErrorKind.TIMEOUT, "No response from " + agentId + " within " + timeoutMs + "ms (message " + messageId + ")");
        this.agentId = agentId;
        this.messageId = messageId;
        this.timeoutMs = timeoutMs;
    }

    public String agentId() {
        return agentId;
    }

    public String messageId() {
        return messageId;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
