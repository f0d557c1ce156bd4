package io.agentmesh.dispatch;

import java.util.Map;

/**
 * Answers a query without any agent.
 */
public interface DirectResponder {
    String respond(String query, Map<String, Object> context);
}
