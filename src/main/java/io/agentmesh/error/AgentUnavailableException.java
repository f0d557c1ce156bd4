package io.agentmesh.error;

public final class AgentUnavailableException extends AgentMeshException {
    private final String agentId;

    public AgentUnavailableException(String agentId) {
        super(ErrorKind.AGENT_UNAVAILABLE, "Agent not registered: " + agentId);
        this.agentId = agentId;
    }

    public String agentId() {
        return agentId;
    }
}
