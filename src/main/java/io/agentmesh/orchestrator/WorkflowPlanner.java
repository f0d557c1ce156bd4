package io.agentmesh.orchestrator;

import io.agentmesh.error.InvalidPlanException;
import io.agentmesh.model.AgentRecord;
import io.agentmesh.model.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Builds a validated {@link Workflow} from a {@link Planner}'s output. Structural problems
 * (duplicate or blank ids, unknown dependencies, cycles) reject the plan; a capability no
 * registered agent advertises is only logged, since selection can still widen or fall back.
 */
public final class WorkflowPlanner {
    private static final Logger log = LoggerFactory.getLogger(WorkflowPlanner.class);

    private final Planner planner;
    private final Supplier<List<AgentRecord>> agents;
    private final Clock clock;

    public WorkflowPlanner(Planner planner, Supplier<List<AgentRecord>> agents, Clock clock) {
        this.planner = planner;
        this.agents = agents;
        this.clock = clock;
    }

    public Workflow plan(String request, Map<String, Object> context) {
        List<SubtaskSpec> specs = planner.decompose(request, context == null ? Map.of() : context);
        validate(specs);
        warnOnUnmetCapabilities(specs);
        Workflow workflow = new Workflow(request, specs, clock);
        log.debug("Planned workflow {} with {} subtasks", workflow.id(), specs.size());
        return workflow;
    }

    static void validate(List<SubtaskSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new InvalidPlanException("Plan must contain at least one subtask");
        }
        Set<String> ids = new HashSet<>();
        for (SubtaskSpec spec : specs) {
            if (spec.id() == null || spec.id().isBlank()) {
                throw new InvalidPlanException("Subtask id cannot be empty");
            }
            if (spec.requiredCapability() == null) {
                throw new InvalidPlanException("Subtask has no required capability: " + spec.id());
            }
            if (!ids.add(spec.id())) {
                throw new InvalidPlanException("Duplicate subtask id: " + spec.id());
            }
        }
        Map<String, List<String>> graph = new HashMap<>();
        for (SubtaskSpec spec : specs) {
            for (String dep : spec.dependencies()) {
                if (!ids.contains(dep)) {
                    throw new InvalidPlanException("Unknown dependency " + dep + " of subtask " + spec.id());
                }
            }
            graph.put(spec.id(), new ArrayList<>(spec.dependencies()));
        }
        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (SubtaskSpec spec : specs) {
            dfsCycleCheck(spec.id(), graph, visiting, visited);
        }
    }

    private static void dfsCycleCheck(String id, Map<String, List<String>> graph, Set<String> visiting, Set<String> visited) {
        if (visited.contains(id)) {
            return;
        }
        if (!visiting.add(id)) {
            throw new InvalidPlanException("Plan contains cycle at subtask: " + id);
        }
        for (String dep : graph.getOrDefault(id, List.of())) {
            dfsCycleCheck(dep, graph, visiting, visited);
        }
        visiting.remove(id);
        visited.add(id);
    }

    private void warnOnUnmetCapabilities(List<SubtaskSpec> specs) {
        Set<Capability> advertised = new HashSet<>();
        for (AgentRecord record : agents.get()) {
            advertised.addAll(record.capabilities());
        }
        Set<Capability> missing = new LinkedHashSet<>();
        for (SubtaskSpec spec : specs) {
            if (!advertised.contains(spec.requiredCapability())) {
                missing.add(spec.requiredCapability());
            }
        }
        if (!missing.isEmpty()) {
            log.warn("No registered agent advertises {}; selection will widen or fall back", missing);
        }
    }
}
