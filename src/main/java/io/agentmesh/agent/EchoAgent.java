package io.agentmesh.agent;

import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentResponse;
import io.agentmesh.model.Capability;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public final class EchoAgent extends AbstractAgent {
    public static final String DEFAULT_ID = "echo";

    public EchoAgent() {
        this(DEFAULT_ID);
    }

    public EchoAgent(String id) {
        super(id, AgentKind.ECHO, Set.of(Capability.ECHO, Capability.GENERAL_PROCESSING));
    }

    @Override
    public AgentResponse process(String query, Map<String, Object> context) {
        String text = query == null ? "" : query;
        List<String> contextKeys = context == null ? List.of() : List.copyOf(new TreeSet<>(context.keySet()));
        return AgentResponse.ok("Echo: " + text, Map.of(
                "agent_id", id(),
                "timestamp", Instant.now().toString(),
                "query_length", text.length(),
                "context_keys", contextKeys
        ));
    }
}
