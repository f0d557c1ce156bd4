package io.agentmesh.error;

import io.agentmesh.model.Capability;

public final class NoAgentAvailableException extends AgentMeshException {
    private final Capability capability;

    public NoAgentAvailableException(Capability capability) {
        super(ErrorKind.NO_AGENT_AVAILABLE, "No agent available for capability: " + capability.tag());
        this.capability = capability;
    }

    public Capability capability() {
        return capability;
    }
}
