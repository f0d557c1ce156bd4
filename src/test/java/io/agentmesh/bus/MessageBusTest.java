package io.agentmesh.bus;

import io.agentmesh.agent.StubAgent;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.error.AgentApplicationException;
import io.agentmesh.error.AgentTimeoutException;
import io.agentmesh.error.AgentUnavailableException;
import io.agentmesh.error.InvalidTransitionException;
import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentResponse;
import io.agentmesh.model.AgentState;
import io.agentmesh.model.Capability;
import io.agentmesh.model.Message;
import io.agentmesh.model.MessageType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

final class MessageBusTest {

    @Test
    void unknownReceiverFailsImmediately() {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            CompletableFuture<Message> future = bus.send(Message.request("tester", "ghost", "hi", Map.of()));

            Assertions.assertTrue(future.isCompletedExceptionally());
            ExecutionException ex = Assertions.assertThrows(ExecutionException.class, future::get);
            Assertions.assertInstanceOf(AgentUnavailableException.class, ex.getCause());
            Assertions.assertThrows(AgentUnavailableException.class,
                    () -> bus.sendAndAwait(Message.request("tester", "ghost", "hi", Map.of())));
        }
    }

    @Test
    void requestIsAnsweredWithCorrelatedReply() {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            StubAgent agent = StubAgent.replying("a1", Capability.ANALYSIS);
            bus.register(agent);
            Message request = Message.request("tester", "a1", "inspect", Map.of());

            Message reply = bus.sendAndAwait(request);

            Assertions.assertEquals(MessageType.RESPONSE, reply.type());
            Assertions.assertEquals("a1: inspect", reply.content());
            Assertions.assertEquals("a1", reply.senderId());
            Assertions.assertEquals("tester", reply.receiverId());
            Assertions.assertEquals(AgentState.IDLE, agent.state());
            Assertions.assertEquals(0, bus.pendingCount());
        }
    }

    @Test
    void timeoutRetriesWithGrowingDeadline() {
        MeshSettings settings = MeshSettings.defaults().withDefaultTimeoutMs(1_000L).withRetry(2, 1.5d);
        try (MessageBus bus = new MessageBus(settings)) {
            StubAgent slow = StubAgent.slow("slow", 3_000L, Capability.ANALYSIS);
            bus.register(slow);

            long started = System.nanoTime();
            AgentTimeoutException ex = Assertions.assertThrows(AgentTimeoutException.class,
                    () -> bus.sendAndAwait(Message.request("tester", "slow", "work", Map.of())));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            Assertions.assertEquals(1_500L, ex.timeoutMs());
            Assertions.assertTrue(elapsedMs >= 2_400L, "elapsed " + elapsedMs);
            Assertions.assertTrue(elapsedMs < 4_000L, "elapsed " + elapsedMs);
        }
    }

    @Test
    void lateReplyIsDiscarded() throws Exception {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            bus.register(StubAgent.slow("slow", 300L, Capability.ANALYSIS));
            Message request = Message.request("tester", "slow", "work", Map.of()).withTimeoutMs(50L);

            CompletableFuture<Message> future = bus.send(request);
            ExecutionException ex = Assertions.assertThrows(ExecutionException.class, future::get);
            Assertions.assertInstanceOf(AgentTimeoutException.class, ex.getCause());

            awaitCondition(() -> bus.lateReplyCount() == 1L, 3_000L);
            Assertions.assertEquals(0, bus.pendingCount());
        }
    }

    @Test
    void applicationErrorIsPassedThroughAndNotRetried() {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            StubAgent failing = StubAgent.failing("bad", "disk quota exceeded", Capability.FILE_MANAGEMENT);
            bus.register(failing);

            AgentApplicationException ex = Assertions.assertThrows(AgentApplicationException.class,
                    () -> bus.sendAndAwait(Message.request("tester", "bad", "write", Map.of())));

            Assertions.assertEquals("disk quota exceeded", ex.getMessage());
            Assertions.assertEquals(MessageType.ERROR, ex.reply().type());
            Assertions.assertEquals(1, failing.calls());
            Assertions.assertEquals(AgentState.ERROR, failing.state());
            Assertions.assertEquals(0.0d, bus.findRecord("bad").orElseThrow().successRate());
        }
    }

    @Test
    void agentRecoversFromErrorOnNextMessage() {
        AtomicInteger calls = new AtomicInteger();
        StubAgent flaky = new StubAgent("flaky", AgentKind.GENERIC, (q, ctx) -> calls.incrementAndGet() == 1
                ? AgentResponse.fail("first call fails")
                : AgentResponse.ok("fine"), 0L, Capability.ANALYSIS);
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            bus.register(flaky);

            Assertions.assertThrows(AgentApplicationException.class,
                    () -> bus.sendAndAwait(Message.request("tester", "flaky", "1", Map.of())));
            Message reply = bus.sendAndAwait(Message.request("tester", "flaky", "2", Map.of()));

            Assertions.assertEquals("fine", reply.content());
            Assertions.assertEquals(AgentState.IDLE, flaky.state());
            Assertions.assertNotNull(flaky.lastFailureAtMs());
            Assertions.assertEquals(0.5d, bus.findRecord("flaky").orElseThrow().successRate(), 1e-9);
        }
    }

    @Test
    void oneAgentHandlesOneMessageAtATime() throws Exception {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            StubAgent agent = StubAgent.slow("serial", 40L, Capability.ANALYSIS);
            bus.register(agent);

            List<CompletableFuture<Message>> futures = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                futures.add(bus.send(Message.request("tester", "serial", "m" + i, Map.of())));
            }
            for (CompletableFuture<Message> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }

            Assertions.assertEquals(5, agent.calls());
            Assertions.assertEquals(1, agent.maxInFlight());
            Assertions.assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), agent.queries());
        }
    }

    @Test
    void distinctAgentsRunConcurrently() throws Exception {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            bus.register(StubAgent.slow("left", 400L, Capability.ANALYSIS));
            bus.register(StubAgent.slow("right", 400L, Capability.ANALYSIS));

            long started = System.nanoTime();
            CompletableFuture<Message> left = bus.send(Message.request("tester", "left", "x", Map.of()));
            CompletableFuture<Message> right = bus.send(Message.request("tester", "right", "y", Map.of()));
            left.get(5, TimeUnit.SECONDS);
            right.get(5, TimeUnit.SECONDS);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            Assertions.assertTrue(elapsedMs < 750L, "elapsed " + elapsedMs);
        }
    }

    @Test
    void broadcastSkipsSender() throws Exception {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            StubAgent a = StubAgent.replying("a", Capability.ANALYSIS);
            StubAgent b = StubAgent.replying("b", Capability.SEARCH);
            StubAgent c = StubAgent.replying("c", Capability.MEMORY);
            bus.register(a);
            bus.register(b);
            bus.register(c);

            int queued = bus.broadcast(Message.notification("a", "config reloaded", Map.of()));

            Assertions.assertEquals(2, queued);
            awaitCondition(() -> b.notifications().size() == 1 && c.notifications().size() == 1, 2_000L);
            Assertions.assertTrue(a.notifications().isEmpty());
            Assertions.assertEquals("c", c.notifications().get(0).receiverId());
        }
    }

    @Test
    void reRegisteringReplacesPreviousAgent() {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            bus.register(new StubAgent("x", AgentKind.GENERIC, (q, ctx) -> AgentResponse.ok("old"), 0L, Capability.ANALYSIS));
            bus.register(new StubAgent("x", AgentKind.GENERIC, (q, ctx) -> AgentResponse.ok("new"), 0L, Capability.SEARCH));

            Message reply = bus.sendAndAwait(Message.request("tester", "x", "q", Map.of()));

            Assertions.assertEquals("new", reply.content());
            Assertions.assertEquals(1, bus.agentRecords().size());
            Assertions.assertTrue(bus.findRecord("x").orElseThrow().advertises(Capability.SEARCH));
        }
    }

    @Test
    void deregisteredAgentIsUnavailable() {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            bus.register(StubAgent.replying("gone", Capability.ANALYSIS));
            Assertions.assertTrue(bus.deregister("gone"));
            Assertions.assertFalse(bus.deregister("gone"));

            Assertions.assertThrows(AgentUnavailableException.class,
                    () -> bus.sendAndAwait(Message.request("tester", "gone", "q", Map.of())));
            Assertions.assertTrue(bus.findRecord("gone").isEmpty());
        }
    }

    @Test
    void kindOverrideAppliesWhenMessageHasNoTimeout() {
        MeshSettings settings = MeshSettings.defaults().withTimeoutOverride(AgentKind.CODE, 120L);
        try (MessageBus bus = new MessageBus(settings)) {
            Message plain = Message.request("tester", "coder", "q", Map.of());
            Assertions.assertEquals(120L, bus.resolveTimeoutMs(plain, AgentKind.CODE));
            Assertions.assertEquals(MeshSettings.DEFAULT_TIMEOUT_MS, bus.resolveTimeoutMs(plain, AgentKind.ECHO));
            Assertions.assertEquals(50L, bus.resolveTimeoutMs(plain.withTimeoutMs(50L), AgentKind.CODE));
        }
    }

    @Test
    void retryPolicyScalesDeadlinePerAttempt() {
        RetryPolicy policy = new RetryPolicy(3, 1.5d);
        Assertions.assertEquals(1_000L, policy.timeoutForAttempt(1_000L, 1));
        Assertions.assertEquals(1_500L, policy.timeoutForAttempt(1_000L, 2));
        Assertions.assertEquals(2_250L, policy.timeoutForAttempt(1_000L, 3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1.5d));
    }

    @Test
    void agentInWrongStateFailsFastWithoutRetry() {
        MeshSettings settings = MeshSettings.defaults().withDefaultTimeoutMs(1_000L).withRetry(2, 1.5d);
        try (MessageBus bus = new MessageBus(settings)) {
            StubAgent echo1 = StubAgent.replying("echo1", Capability.ECHO);
            bus.register(echo1);
            echo1.setState(AgentState.PROCESSING);

            long started = System.nanoTime();
            InvalidTransitionException ex = Assertions.assertThrows(InvalidTransitionException.class,
                    () -> bus.sendAndAwait(Message.request("tester", "echo1", "hi", Map.of())));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            Assertions.assertEquals(AgentState.PROCESSING, ex.from());
            Assertions.assertEquals(AgentState.PROCESSING, ex.to());
            Assertions.assertTrue(elapsedMs < 900L, "elapsed " + elapsedMs);
            Assertions.assertEquals(0, echo1.calls());
            Assertions.assertEquals(0, bus.pendingCount());
        }
    }

    @Test
    void fatalErrorInAgentStillCompletesTheReply() throws Exception {
        try (MessageBus bus = new MessageBus(MeshSettings.defaults())) {
            StubAgent broken = new StubAgent("broken", AgentKind.GENERIC, (q, ctx) -> {
                throw new StackOverflowError("too deep");
            }, 0L, Capability.ANALYSIS);
            bus.register(broken);

            CompletableFuture<Message> future = bus.send(Message.request("tester", "broken", "recurse", Map.of()));
            ExecutionException ex = Assertions.assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));

            Assertions.assertInstanceOf(AgentApplicationException.class, ex.getCause());
            Assertions.assertTrue(ex.getCause().getMessage().contains("too deep"));
            Assertions.assertEquals(AgentState.ERROR, broken.state());
        }
    }

    private static void awaitCondition(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("condition not met within " + timeoutMs + "ms");
            }
            Thread.sleep(10L);
        }
    }
}
