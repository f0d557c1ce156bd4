package io.agentmesh.bus;

import io.agentmesh.agent.Agent;
import io.agentmesh.agent.AgentRegistry;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.error.AgentApplicationException;
import io.agentmesh.error.AgentMeshException;
import io.agentmesh.error.AgentTimeoutException;
import io.agentmesh.error.AgentUnavailableException;
import io.agentmesh.error.InvalidTransitionException;
import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentRecord;
import io.agentmesh.model.AgentResponse;
import io.agentmesh.model.AgentState;
import io.agentmesh.model.Message;
import io.agentmesh.model.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process router between registered agents.
 *
 * <p>Every agent owns a single-thread mailbox, so one agent handles one message at a time
 * while distinct agents run concurrently. Requests are correlated with replies by message
 * id; a reply whose request is no longer pending (timed out, or the bus was closed) is
 * dropped.
 */
public final class MessageBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final AgentRegistry registry;
    private final MeshSettings settings;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService timer;
    private final Map<String, PendingReply> pending = new ConcurrentHashMap<>();
    private final AtomicLong lateReplies = new AtomicLong(0L);
    private volatile boolean closed;

    public MessageBus(MeshSettings settings) {
        this(new AgentRegistry(), settings);
    }

    public MessageBus(AgentRegistry registry, MeshSettings settings) {
        this.registry = registry;
        this.settings = settings == null ? MeshSettings.defaults() : settings;
        this.retryPolicy = RetryPolicy.from(this.settings);
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentmesh-bus-timer");
            t.setDaemon(true);
            return t;
        });
    }

    public void register(Agent agent) {
        if (closed) {
            throw new IllegalStateException("bus is closed");
        }
        ExecutorService mailbox = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agentmesh-agent-" + agent.id());
            t.setDaemon(true);
            return t;
        });
        Optional<AgentRegistry.Entry> replaced = registry.register(agent, mailbox);
        if (replaced.isPresent()) {
            log.warn("Agent {} re-registered, previous instance replaced", agent.id());
            replaced.get().mailbox().shutdown();
        } else {
            log.info("Registered agent {} kind={} capabilities={}", agent.id(), agent.kind().wire(), agent.capabilities());
        }
    }

    public boolean deregister(String agentId) {
        Optional<AgentRegistry.Entry> removed = registry.remove(agentId);
        removed.ifPresent(entry -> {
            entry.mailbox().shutdown();
            log.info("Deregistered agent {}", agentId);
        });
        return removed.isPresent();
    }

    /**
     * Delivers a request and returns a future completed with the reply.
     *
     * <p>The future fails with {@link AgentUnavailableException} immediately when the
     * receiver is unknown, with {@link AgentTimeoutException} when the resolved deadline
     * passes first, with {@link AgentApplicationException} when the agent throws or
     * returns an error, and with {@link InvalidTransitionException} when the agent's state
     * does not allow it to take the message. The agent's work is not interrupted on timeout.
     */
    public CompletableFuture<Message> send(Message message) {
        if (message.broadcast()) {
            throw new IllegalArgumentException("send requires a receiver, use broadcast(): " + message.id());
        }
        Optional<AgentRegistry.Entry> target = closed ? Optional.empty() : registry.find(message.receiverId());
        if (target.isEmpty()) {
            return CompletableFuture.failedFuture(new AgentUnavailableException(message.receiverId()));
        }
        AgentRegistry.Entry entry = target.get();
        long timeoutMs = resolveTimeoutMs(message, entry.agent().kind());
        CompletableFuture<Message> future = new CompletableFuture<>();
        PendingReply slot = new PendingReply(message.receiverId(), future);
        pending.put(message.id(), slot);

        ScheduledFuture<?> deadline = timer.schedule(() -> {
            if (pending.remove(message.id(), slot)) {
                log.debug("Message {} to {} timed out after {}ms", message.id(), message.receiverId(), timeoutMs);
                future.completeExceptionally(new AgentTimeoutException(message.receiverId(), message.id(), timeoutMs));
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        future.whenComplete((reply, error) -> deadline.cancel(false));

        try {
            entry.mailbox().execute(() -> deliver(entry, message));
        } catch (RejectedExecutionException e) {
            if (pending.remove(message.id(), slot)) {
                future.completeExceptionally(new AgentUnavailableException(message.receiverId()));
            }
        }
        return future;
    }

    /**
     * Blocking send with the configured retry policy. Only timeouts and unavailable
     * receivers are retried; each retry is a fresh message id with a longer deadline.
     */
    public Message sendAndAwait(Message message) {
        long baseTimeoutMs = baseTimeoutMs(message);
        Message current = message.withTimeoutMs(retryPolicy.timeoutForAttempt(baseTimeoutMs, 1));
        for (int attempt = 1; ; attempt++) {
            try {
                return await(send(current));
            } catch (AgentMeshException e) {
                if (!e.retryable() || attempt >= retryPolicy.maxAttempts()) {
                    throw e;
                }
                long nextTimeoutMs = retryPolicy.timeoutForAttempt(baseTimeoutMs, attempt + 1);
                log.warn("Attempt {}/{} to {} failed ({}), retrying with timeout {}ms",
                        attempt, retryPolicy.maxAttempts(), message.receiverId(), e.kind(), nextTimeoutMs);
                current = current.nextAttempt(nextTimeoutMs);
            }
        }
    }

    /**
     * Best-effort notification to every registered agent except the sender.
     *
     * @return number of agents the notification was queued for
     */
    public int broadcast(Message message) {
        int queued = 0;
        for (AgentRegistry.Entry entry : registry.entries()) {
            Agent agent = entry.agent();
            if (agent.id().equals(message.senderId())) {
                continue;
            }
            Message copy = message.withReceiver(agent.id());
            try {
                entry.mailbox().execute(() -> {
                    try {
                        agent.onNotification(copy);
                    } catch (RuntimeException e) {
                        log.warn("Agent {} failed to handle notification {}", agent.id(), copy.id(), e);
                    }
                });
                queued++;
            } catch (RejectedExecutionException e) {
                log.warn("Agent {} mailbox rejected notification {}", agent.id(), copy.id());
            }
        }
        return queued;
    }

    public List<AgentRecord> agentRecords() {
        return registry.records();
    }

    public Optional<AgentRecord> findRecord(String agentId) {
        return registry.record(agentId);
    }

    public List<String> listAgentIds() {
        return registry.listAgentIds();
    }

    public MeshSettings settings() {
        return settings;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public int pendingCount() {
        return pending.size();
    }

    public long lateReplyCount() {
        return lateReplies.get();
    }

    long resolveTimeoutMs(Message message, AgentKind kind) {
        if (message.timeoutMs() != null && message.timeoutMs() > 0L) {
            return message.timeoutMs();
        }
        return settings.timeoutFor(kind);
    }

    private long baseTimeoutMs(Message message) {
        AgentKind kind = registry.find(message.receiverId())
                .map(entry -> entry.agent().kind())
                .orElse(null);
        return resolveTimeoutMs(message, kind);
    }

    private Message await(CompletableFuture<Message> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting reply", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RuntimeException("Agent delivery failed", cause);
        }
    }

    private void deliver(AgentRegistry.Entry entry, Message message) {
        Agent agent = entry.agent();
        try {
            if (agent.state() == AgentState.ERROR) {
                agent.setState(AgentState.IDLE);
            }
            agent.setState(AgentState.PROCESSING);
        } catch (InvalidTransitionException e) {
            log.warn("Agent {} cannot take message {}: {}", agent.id(), message.id(), e.getMessage());
            complete(message.reply(MessageType.ERROR, e.getMessage(), Map.of("error", e.getMessage())), e);
            return;
        }

        AgentResponse response = null;
        String error;
        Error fatal = null;
        try {
            response = agent.process(message.content(), message.context());
            error = response == null ? "agent returned no response" : response.error();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "interrupted";
        } catch (Exception e) {
            log.debug("Agent {} threw while processing {}", agent.id(), message.id(), e);
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        } catch (Error e) {
            log.error("Agent {} hit a fatal error while processing {}", agent.id(), message.id(), e);
            error = e.toString();
            fatal = e;
        }

        try {
            if (error == null) {
                agent.setState(AgentState.IDLE);
                entry.recordSuccess();
                complete(message.reply(MessageType.RESPONSE, response.content(), response.metadata()), null);
            } else {
                agent.setState(AgentState.ERROR);
                entry.recordFailure();
                Message reply = message.reply(MessageType.ERROR, error, Map.of("error", error));
                complete(reply, new AgentApplicationException(agent.id(), error, reply));
            }
        } catch (InvalidTransitionException e) {
            log.warn("Agent {} state changed underneath message {}: {}", agent.id(), message.id(), e.getMessage());
            entry.recordFailure();
            complete(message.reply(MessageType.ERROR, e.getMessage(), Map.of("error", e.getMessage())), e);
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private void complete(Message reply, AgentMeshException failure) {
        PendingReply slot = pending.remove(reply.correlationId());
        if (slot == null) {
            lateReplies.incrementAndGet();
            log.debug("Discarding late reply {} from {} for {}", reply.id(), reply.senderId(), reply.correlationId());
            return;
        }
        if (failure != null) {
            slot.future().completeExceptionally(failure);
        } else {
            slot.future().complete(reply);
        }
    }

    @Override
    public void close() {
        closed = true;
        for (AgentRegistry.Entry entry : registry.entries()) {
            entry.mailbox().shutdownNow();
        }
        for (Map.Entry<String, PendingReply> item : pending.entrySet()) {
            if (pending.remove(item.getKey(), item.getValue())) {
                item.getValue().future().completeExceptionally(new AgentUnavailableException(item.getValue().receiverId()));
            }
        }
        timer.shutdownNow();
    }

    private record PendingReply(String receiverId, CompletableFuture<Message> future) {
    }
}
