package io.agentmesh.orchestrator;

import io.agentmesh.error.NoAgentAvailableException;
import io.agentmesh.model.AgentRecord;
import io.agentmesh.model.Capability;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Picks an agent for a capability.
 *
 * <p>Exact matches win when one of them is idle. Otherwise the pool widens to agents of the
 * same capability family and general-purpose agents. Within the pool the highest score
 * wins, ties going to the smallest id:
 *
 * <pre>
 * score = 0.6 * idle + 0.3 * successRate - 0.1 * recentFailure
 * </pre>
 *
 * where {@code recentFailure} falls linearly from 1 to 0 over the minute after the agent
 * last entered the error state.
 */
public final class AgentSelector {
    static final double IDLE_WEIGHT = 0.6d;
    static final double SUCCESS_WEIGHT = 0.3d;
    static final double RECENT_FAILURE_WEIGHT = 0.1d;
    static final long FAILURE_DECAY_MS = 60_000L;

    private final Supplier<List<AgentRecord>> agents;
    private final String fallbackAgentId;
    private final Clock clock;

    public AgentSelector(Supplier<List<AgentRecord>> agents, String fallbackAgentId, Clock clock) {
        this.agents = agents;
        this.fallbackAgentId = fallbackAgentId;
        this.clock = clock;
    }

    public String select(Capability capability) {
        return select(capability, Set.of());
    }

    public String select(Capability capability, Set<String> excluded) {
        List<AgentRecord> candidates = new ArrayList<>();
        for (AgentRecord record : agents.get()) {
            if (!excluded.contains(record.agentId())) {
                candidates.add(record);
            }
        }

        List<AgentRecord> exact = new ArrayList<>();
        boolean exactIdle = false;
        for (AgentRecord record : candidates) {
            if (record.advertises(capability)) {
                exact.add(record);
                exactIdle |= record.idle();
            }
        }
        List<AgentRecord> pool = exactIdle ? exact : widen(candidates, capability);
        if (pool.isEmpty()) {
            return fallback(candidates, capability);
        }

        long now = clock.millis();
        AgentRecord best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (AgentRecord record : pool) {
            double score = score(record, now);
            if (best == null
                    || score > bestScore
                    || (score == bestScore && record.agentId().compareTo(best.agentId()) < 0)) {
                best = record;
                bestScore = score;
            }
        }
        return best.agentId();
    }

    double score(AgentRecord record, long nowMs) {
        double idle = record.idle() ? 1.0d : 0.0d;
        return IDLE_WEIGHT * idle
                + SUCCESS_WEIGHT * record.successRate()
                - RECENT_FAILURE_WEIGHT * recentFailure(record, nowMs);
    }

    private double recentFailure(AgentRecord record, long nowMs) {
        if (record.lastFailureAtMs() == null) {
            return 0.0d;
        }
        long age = Math.max(0L, nowMs - record.lastFailureAtMs());
        if (age >= FAILURE_DECAY_MS) {
            return 0.0d;
        }
        return 1.0d - (double) age / (double) FAILURE_DECAY_MS;
    }

    private List<AgentRecord> widen(List<AgentRecord> candidates, Capability capability) {
        List<AgentRecord> pool = new ArrayList<>();
        for (AgentRecord record : candidates) {
            if (record.advertises(capability) || record.advertises(Capability.GENERAL_PROCESSING)) {
                pool.add(record);
                continue;
            }
            for (Capability advertised : record.capabilities()) {
                if (advertised.sameFamily(capability)) {
                    pool.add(record);
                    break;
                }
            }
        }
        return pool;
    }

    private String fallback(List<AgentRecord> candidates, Capability capability) {
        if (fallbackAgentId != null) {
            for (AgentRecord record : candidates) {
                if (record.agentId().equals(fallbackAgentId)) {
                    return fallbackAgentId;
                }
            }
        }
        throw new NoAgentAvailableException(capability);
    }
}
