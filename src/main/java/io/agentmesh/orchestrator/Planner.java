package io.agentmesh.orchestrator;

import java.util.List;
import java.util.Map;

/**
 * Turns a request into subtask specs. Implementations may call out to a model; the
 * returned list is validated by {@link WorkflowPlanner} before anything runs.
 */
public interface Planner {
    List<SubtaskSpec> decompose(String request, Map<String, Object> context);
}
