package io.agentmesh.orchestrator;

import io.agentmesh.error.InvalidPlanException;
import io.agentmesh.model.Capability;
import io.agentmesh.model.SubtaskStatus;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

final class WorkflowPlannerTest {

    @Test
    void cycleIsRejectedBeforeExecution() {
        Planner cyclic = (request, ctx) -> List.of(
                SubtaskSpec.of("a", "first", Capability.ANALYSIS, "c"),
                SubtaskSpec.of("b", "second", Capability.ANALYSIS, "a"),
                SubtaskSpec.of("c", "third", Capability.ANALYSIS, "b")
        );
        WorkflowPlanner planner = new WorkflowPlanner(cyclic, List::of, Clock.systemUTC());

        InvalidPlanException ex = Assertions.assertThrows(InvalidPlanException.class,
                () -> planner.plan("loop", Map.of()));
        Assertions.assertTrue(ex.getMessage().contains("cycle"));
    }

    @Test
    void selfDependencyIsACycle() {
        Assertions.assertThrows(InvalidPlanException.class, () -> WorkflowPlanner.validate(List.of(
                SubtaskSpec.of("a", "self", Capability.ANALYSIS, "a"))));
    }

    @Test
    void unknownDependencyAndDuplicateIdsAreRejected() {
        Assertions.assertThrows(InvalidPlanException.class, () -> WorkflowPlanner.validate(List.of(
                SubtaskSpec.of("a", "x", Capability.ANALYSIS, "missing"))));
        Assertions.assertThrows(InvalidPlanException.class, () -> WorkflowPlanner.validate(List.of(
                SubtaskSpec.of("a", "x", Capability.ANALYSIS),
                SubtaskSpec.of("a", "y", Capability.SEARCH))));
        Assertions.assertThrows(InvalidPlanException.class, () -> WorkflowPlanner.validate(List.of()));
    }

    @Test
    void indivisibleRequestYieldsSingleNode() {
        WorkflowPlanner planner = new WorkflowPlanner(new RuleBasedPlanner(), List::of, Clock.systemUTC());

        Workflow workflow = planner.plan("tell me a story about the sea", Map.of());
        WorkflowView view = workflow.toView();

        Assertions.assertEquals(WorkflowStatus.PLANNING, view.status());
        Assertions.assertEquals(1, view.subtasks().size());
        Assertions.assertTrue(view.subtasks().get(0).dependencies().isEmpty());
        Assertions.assertEquals(Capability.GENERAL_PROCESSING, view.subtasks().get(0).requiredCapability());
        Assertions.assertEquals(SubtaskStatus.PENDING, view.subtasks().get(0).status());
        Assertions.assertTrue(view.history().isEmpty());
    }

    @Test
    void unmetCapabilityIsOnlyAWarning() {
        WorkflowPlanner planner = new WorkflowPlanner(new RuleBasedPlanner(), List::of, Clock.systemUTC());

        Workflow workflow = Assertions.assertDoesNotThrow(
                () -> planner.plan("write a python script that parses logs", Map.of()));
        Assertions.assertEquals(3, workflow.subtasks().size());
    }

    @Test
    void ruleBasedPlannerShapes() {
        RuleBasedPlanner planner = new RuleBasedPlanner();

        List<SubtaskSpec> code = planner.decompose("implement a java function to sort numbers", Map.of());
        Assertions.assertEquals(List.of("analyze", "implement", "test"), code.stream().map(SubtaskSpec::id).toList());
        Assertions.assertEquals(List.of("analyze"), code.get(1).dependencies());
        Assertions.assertEquals(Capability.TESTING, code.get(2).requiredCapability());

        List<SubtaskSpec> research = planner.decompose("research the history of espresso", Map.of());
        Assertions.assertEquals(List.of("search", "summarize"), research.stream().map(SubtaskSpec::id).toList());
        Assertions.assertEquals(List.of("search"), research.get(1).dependencies());

        List<SubtaskSpec> system = planner.decompose("list the directory contents", Map.of());
        Assertions.assertEquals(Capability.SYSTEM_OPERATIONS, system.get(0).requiredCapability());

        List<SubtaskSpec> echo = planner.decompose("echo this back", Map.of());
        Assertions.assertEquals(Capability.ECHO, echo.get(0).requiredCapability());
    }
}
