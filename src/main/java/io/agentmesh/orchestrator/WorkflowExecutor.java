package io.agentmesh.orchestrator;

import io.agentmesh.bus.MessageBus;
import io.agentmesh.error.AgentMeshException;
import io.agentmesh.error.AgentUnavailableException;
import io.agentmesh.error.NoAgentAvailableException;
import io.agentmesh.model.Message;
import io.agentmesh.model.WorkflowView;
import io.agentmesh.storage.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a workflow in waves: every subtask whose dependencies completed is dispatched
 * together, the wave is awaited, and outcomes are applied in plan order. The store gets a
 * snapshot after each wave. A cancelled workflow stops between waves.
 */
public final class WorkflowExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    private final MessageBus bus;
    private final AgentSelector selector;
    private final WorkflowStore store;
    private final ExecutorService pool;
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    public WorkflowExecutor(MessageBus bus, AgentSelector selector, WorkflowStore store, int maxConcurrentSubtasks) {
        this.bus = bus;
        this.selector = selector;
        this.store = store;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, maxConcurrentSubtasks), r -> {
            Thread t = new Thread(r, "agentmesh-subtask-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public WorkflowView execute(Workflow workflow) {
        running.add(workflow.id());
        try {
            workflow.start();
            store.save(workflow.toView());

            List<Subtask> wave = workflow.promoteReady();
            while (!wave.isEmpty()) {
                List<Dispatch> dispatches = new ArrayList<>(wave.size());
                for (Subtask subtask : wave) {
                    dispatches.add(dispatch(workflow, subtask));
                }
                for (Dispatch dispatch : dispatches) {
                    Outcome outcome = dispatch.await();
                    if (outcome.error() == null) {
                        workflow.markCompleted(dispatch.subtask(), outcome.agentId(), outcome.result());
                    } else {
                        workflow.markFailed(dispatch.subtask(), outcome.agentId(), outcome.error());
                    }
                }
                if (cancelRequested.contains(workflow.id())) {
                    int skipped = workflow.cancelRemaining();
                    log.info("Workflow {} cancelled, {} subtasks skipped", workflow.id(), skipped);
                    store.save(workflow.toView());
                    break;
                }
                store.save(workflow.toView());
                wave = workflow.promoteReady();
            }

            workflow.finish();
            WorkflowView view = workflow.toView();
            store.save(view);
            log.info("Workflow {} finished status={} subtasks={}", view.id(), view.status().wire(), view.subtasks().size());
            return view;
        } finally {
            running.remove(workflow.id());
            cancelRequested.remove(workflow.id());
        }
    }

    /**
     * Asks a running workflow to stop after its current wave. Subtasks already dispatched
     * finish normally; the rest are skipped.
     *
     * @return false when no workflow with that id is running here
     */
    public boolean cancel(String workflowId) {
        if (workflowId == null || !running.contains(workflowId)) {
            return false;
        }
        cancelRequested.add(workflowId);
        if (!running.contains(workflowId)) {
            cancelRequested.remove(workflowId);
            return false;
        }
        log.info("Cancellation requested for workflow {}", workflowId);
        return true;
    }

    private Dispatch dispatch(Workflow workflow, Subtask subtask) {
        String agentId;
        try {
            agentId = selector.select(subtask.requiredCapability());
        } catch (NoAgentAvailableException e) {
            return new Dispatch(subtask, null, new Outcome(null, null, e.getMessage()));
        }
        workflow.markRunning(subtask, agentId);

        Map<String, String> dependencyResults = new LinkedHashMap<>();
        for (String dep : subtask.dependencies()) {
            workflow.subtask(dep).ifPresent(d -> dependencyResults.put(dep, d.result()));
        }
        String content = requestContent(subtask, dependencyResults);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("workflow_id", workflow.id());
        context.put("subtask_id", subtask.id());
        context.put("capability", subtask.requiredCapability().tag());
        context.put("dependency_results", dependencyResults);

        Future<Outcome> future = pool.submit(() -> run(subtask, agentId, content, context));
        return new Dispatch(subtask, future, null);
    }

    private Outcome run(Subtask subtask, String agentId, String content, Map<String, Object> context) {
        try {
            Message reply = bus.sendAndAwait(Message.request(Orchestrator.ORCHESTRATOR_ID, agentId, content, context));
            return new Outcome(agentId, reply.content(), null);
        } catch (AgentUnavailableException e) {
            return reassign(subtask, agentId, content, context);
        } catch (AgentMeshException e) {
            return new Outcome(agentId, null, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Subtask {} on {} failed unexpectedly", subtask.id(), agentId, e);
            return new Outcome(agentId, null, e.toString());
        }
    }

    private Outcome reassign(Subtask subtask, String failedAgentId, String content, Map<String, Object> context) {
        String alternate;
        try {
            alternate = selector.select(subtask.requiredCapability(), Set.of(failedAgentId));
        } catch (NoAgentAvailableException e) {
            return new Outcome(failedAgentId, null, "agent unavailable: " + failedAgentId);
        }
        log.warn("Agent {} unavailable for subtask {}, reassigning to {}", failedAgentId, subtask.id(), alternate);
        try {
            Message reply = bus.sendAndAwait(Message.request(Orchestrator.ORCHESTRATOR_ID, alternate, content, context));
            return new Outcome(alternate, reply.content(), null);
        } catch (AgentMeshException e) {
            return new Outcome(alternate, null, e.getMessage());
        }
    }

    static String requestContent(Subtask subtask, Map<String, String> dependencyResults) {
        if (dependencyResults.isEmpty()) {
            return subtask.description();
        }
        StringBuilder sb = new StringBuilder(subtask.description());
        sb.append("\n\nResults from previous steps:");
        for (Map.Entry<String, String> entry : dependencyResults.entrySet()) {
            sb.append("\n- ").append(entry.getKey()).append(": ").append(entry.getValue());
        }
        return sb.toString();
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Outcome(String agentId, String result, String error) {
    }

    private record Dispatch(Subtask subtask, Future<Outcome> future, Outcome immediate) {
        Outcome await() {
            if (immediate != null) {
                return immediate;
            }
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                return new Outcome(subtask.assignedAgentId(), null, "interrupted");
            } catch (ExecutionException e) {
                return new Outcome(subtask.assignedAgentId(), null, String.valueOf(e.getCause()));
            }
        }
    }
}
