package io.agentmesh.agent;

import io.agentmesh.error.InvalidTransitionException;
import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentState;
import io.agentmesh.model.Capability;
import io.agentmesh.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;

public abstract class AbstractAgent implements Agent {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String id;
    private final AgentKind kind;
    private final Set<Capability> capabilities;
    private final Clock clock;
    private AgentState state = AgentState.IDLE;
    private Long lastFailureAtMs;

    protected AbstractAgent(String id, AgentKind kind, Set<Capability> capabilities) {
        this(id, kind, capabilities, Clock.systemUTC());
    }

    protected AbstractAgent(String id, AgentKind kind, Set<Capability> capabilities, Clock clock) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("agent must advertise at least one capability: " + id);
        }
        this.id = id;
        this.kind = kind == null ? AgentKind.GENERIC : kind;
        this.capabilities = Set.copyOf(EnumSet.copyOf(capabilities));
        this.clock = clock;
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final AgentKind kind() {
        return kind;
    }

    @Override
    public final Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public synchronized AgentState state() {
        return state;
    }

    @Override
    public synchronized void setState(AgentState next) {
        if (!state.canTransitionTo(next)) {
            throw new InvalidTransitionException(id, state, next);
        }
        log.debug("Agent {} state {} -> {}", id, state, next);
        if (next == AgentState.ERROR) {
            lastFailureAtMs = clock.millis();
        }
        state = next;
    }

    @Override
    public synchronized Long lastFailureAtMs() {
        return lastFailureAtMs;
    }

    @Override
    public void onNotification(Message message) {
        log.info("Agent {} received notification from {}: {}", id, message.senderId(), message.content());
    }
}
