package io.agentmesh.model;

import java.util.Set;

public record AgentRecord(
        String agentId,
        AgentKind kind,
        Set<Capability> capabilities,
        AgentState state,
        double successRate,
        Long lastFailureAtMs
) {
    public AgentRecord {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean idle() {
        return state == AgentState.IDLE;
    }

    public boolean advertises(Capability capability) {
        return capabilities.contains(capability);
    }
}
