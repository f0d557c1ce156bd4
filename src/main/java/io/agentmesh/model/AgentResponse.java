package io.agentmesh.model;

import java.util.Map;

/**
 * Result of {@code Agent.process}. A non-null {@code error} marks an application failure
 * that is passed through to the caller verbatim and never retried.
 */
public record AgentResponse(
        String content,
        Map<String, Object> metadata,
        String error
) {
    public AgentResponse {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AgentResponse ok(String content) {
        return new AgentResponse(content, Map.of(), null);
    }

    public static AgentResponse ok(String content, Map<String, Object> metadata) {
        return new AgentResponse(content, metadata, null);
    }

    public static AgentResponse fail(String error) {
        return new AgentResponse(null, Map.of(), error);
    }

    public boolean success() {
        return error == null;
    }
}
