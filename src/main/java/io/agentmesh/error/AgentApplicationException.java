package io.agentmesh.error;

import io.agentmesh.model.Message;

/**
 * An agent's own business failure. The message is the agent's error text, unchanged.
 */
public final class AgentApplicationException extends AgentMeshException {
    private final String agentId;
    private final transient Message reply;

    public AgentApplicationException(String agentId, String error, Message reply) {
        super(ErrorKind.APPLICATION_ERROR, error);
        this.agentId = agentId;
        this.reply = reply;
    }

    public String agentId() {
        return agentId;
    }

    public Message reply() {
        return reply;
    }
}
