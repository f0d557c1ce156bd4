package io.agentmesh.agent;

import io.agentmesh.model.AgentRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registered agents keyed by id. All mutations go through this object's monitor, so a
 * reader never sees a half-replaced entry.
 */
public final class AgentRegistry {
    private final Map<String, Entry> agents = new TreeMap<>();

    /**
     * Adds or replaces the entry for {@code agent.id()}.
     *
     * @return the entry that was replaced, if any
     */
    public synchronized Optional<Entry> register(Agent agent, ExecutorService mailbox) {
        return Optional.ofNullable(agents.put(agent.id(), new Entry(agent, mailbox)));
    }

    public synchronized Optional<Entry> remove(String agentId) {
        return Optional.ofNullable(agents.remove(agentId));
    }

    public synchronized Optional<Entry> find(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(agentId));
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(agents.values());
    }

    public synchronized List<String> listAgentIds() {
        return List.copyOf(agents.keySet());
    }

    public synchronized List<AgentRecord> records() {
        List<AgentRecord> out = new ArrayList<>(agents.size());
        for (Entry entry : agents.values()) {
            out.add(entry.snapshot());
        }
        return out;
    }

    public synchronized Optional<AgentRecord> record(String agentId) {
        return find(agentId).map(Entry::snapshot);
    }

    public synchronized int size() {
        return agents.size();
    }

    public static final class Entry {
        private final Agent agent;
        private final ExecutorService mailbox;
        private final AtomicLong successes = new AtomicLong(0L);
        private final AtomicLong failures = new AtomicLong(0L);

        Entry(Agent agent, ExecutorService mailbox) {
            this.agent = agent;
            this.mailbox = mailbox;
        }

        public Agent agent() {
            return agent;
        }

        public ExecutorService mailbox() {
            return mailbox;
        }

        public void recordSuccess() {
            successes.incrementAndGet();
        }

        public void recordFailure() {
            failures.incrementAndGet();
        }

        /**
         * Share of successful deliveries; an agent without history counts as fully reliable.
         */
        public double successRate() {
            long ok = successes.get();
            long total = ok + failures.get();
            return total == 0L ? 1.0d : (double) ok / (double) total;
        }

        public AgentRecord snapshot() {
            return new AgentRecord(
                    agent.id(),
                    agent.kind(),
                    agent.capabilities(),
                    agent.state(),
                    successRate(),
                    agent.lastFailureAtMs()
            );
        }
    }
}
