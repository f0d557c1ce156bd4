package io.agentmesh.orchestrator;

import io.agentmesh.bus.MessageBus;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.error.InvalidPlanException;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowSummary;
import io.agentmesh.model.WorkflowView;
import io.agentmesh.storage.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plans, runs and records multi-step workflows. Subtask failures, rejected plans and store
 * failures never escape {@link #run}; they are reported in the {@link WorkflowReport}. A partial workflow is
 * not resumed: callers recover by running a new one.
 */
public final class Orchestrator implements AutoCloseable {
    public static final String ORCHESTRATOR_ID = "orchestrator";

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final WorkflowPlanner workflowPlanner;
    private final WorkflowExecutor executor;
    private final WorkflowStore store;

    public Orchestrator(MessageBus bus, Planner planner, WorkflowStore store, MeshSettings settings) {
        this(bus, planner, store, settings, Clock.systemUTC());
    }

    public Orchestrator(MessageBus bus, Planner planner, WorkflowStore store, MeshSettings settings, Clock clock) {
        this.store = store;
        this.workflowPlanner = new WorkflowPlanner(planner, bus::agentRecords, clock);
        AgentSelector selector = new AgentSelector(bus::agentRecords, settings.fallbackAgentId(), clock);
        this.executor = new WorkflowExecutor(bus, selector, store, settings.maxConcurrentSubtasks());
    }

    /**
     * @throws InvalidPlanException when the decomposition is not a valid DAG
     */
    public Workflow plan(String request, Map<String, Object> context) {
        return workflowPlanner.plan(request, context);
    }

    public WorkflowView execute(Workflow workflow) {
        return executor.execute(workflow);
    }

    public WorkflowReport run(String request, Map<String, Object> context) {
        Workflow workflow;
        try {
            workflow = plan(request, context);
        } catch (InvalidPlanException e) {
            log.warn("Rejected plan for request: {}", e.getMessage());
            return WorkflowReport.rejected(e.getMessage());
        }
        try {
            return WorkflowReport.from(execute(workflow));
        } catch (RuntimeException e) {
            log.error("Workflow {} aborted", workflow.id(), e);
            return WorkflowReport.aborted(workflow.id(), e.getMessage() == null ? e.toString() : e.getMessage());
        }
    }

    /**
     * Cooperative cancellation: the workflow stops after the wave in flight and ends
     * {@code partial} or {@code failed}, with the undispatched subtasks skipped as
     * {@code cancelled}.
     *
     * @return false when the workflow is not running
     */
    public boolean cancel(String workflowId) {
        return executor.cancel(workflowId);
    }

    public List<WorkflowSummary> listWorkflows(WorkflowStatus statusFilter) {
        return store.list(statusFilter);
    }

    public Optional<WorkflowView> getWorkflow(String workflowId) {
        return store.find(workflowId);
    }

    @Override
    public void close() {
        executor.close();
    }
}
