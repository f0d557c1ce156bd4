package io.agentmesh.agent;

import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentResponse;
import io.agentmesh.model.Capability;

import java.util.Map;
import java.util.Set;

public final class FailAgent extends AbstractAgent {
    public static final String DEFAULT_ID = "fail";

    public FailAgent() {
        this(DEFAULT_ID);
    }

    public FailAgent(String id) {
        super(id, AgentKind.GENERIC, Set.of(Capability.DIAGNOSTICS));
    }

    @Override
    public AgentResponse process(String query, Map<String, Object> context) {
        return AgentResponse.fail("intentional failure from fail agent");
    }
}
