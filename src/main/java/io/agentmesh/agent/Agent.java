package io.agentmesh.agent;

import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentResponse;
import io.agentmesh.model.AgentState;
import io.agentmesh.model.Capability;
import io.agentmesh.model.Message;

import java.util.Map;
import java.util.Set;

/**
 * Contract every agent exposes to the bus and the orchestrator.
 *
 * <p>{@link #process} may block on external I/O; it must eventually return or throw. The
 * bus calls it from the agent's own mailbox thread, one message at a time, and drives
 * {@link #setState} around each call.
 */
public interface Agent {
    String id();

    AgentKind kind();

    Set<Capability> capabilities();

    AgentState state();

    /**
     * @throws io.agentmesh.error.InvalidTransitionException when the move is not allowed
     */
    void setState(AgentState next);

    /**
     * Epoch millis of the last move into {@link AgentState#ERROR}, or null.
     */
    Long lastFailureAtMs();

    AgentResponse process(String query, Map<String, Object> context) throws Exception;

    default void onNotification(Message message) {
    }
}
