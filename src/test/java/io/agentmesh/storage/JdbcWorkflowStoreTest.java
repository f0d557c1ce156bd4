package io.agentmesh.storage;

import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.model.Capability;
import io.agentmesh.model.SubtaskStatus;
import io.agentmesh.model.SubtaskView;
import io.agentmesh.model.WorkflowEvent;
import io.agentmesh.model.WorkflowEventType;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowSummary;
import io.agentmesh.model.WorkflowView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class JdbcWorkflowStoreTest {

    @Test
    void storesAndReloadsSnapshotsAcrossInstances() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-test-jdbc-store-");
        try {
            Database db = new Database(AgentMeshConfig.fromRoot(root.toString()));
            db.init();
            WorkflowView view = new WorkflowView(
                    "wf_1",
                    "build a parser",
                    WorkflowStatus.PARTIAL,
                    100L,
                    180L,
                    List.of(
                            new SubtaskView("a", "analyze", Capability.ANALYSIS, "analyst", List.of(),
                                    SubtaskStatus.COMPLETED, "plan", null),
                            new SubtaskView("b", "implement", Capability.CODE_GENERATION, "coder", List.of("a"),
                                    SubtaskStatus.FAILED, null, "compiler missing")
                    ),
                    List.of(
                            new WorkflowEvent(1, "a", WorkflowEventType.READY, null, null, 101L),
                            new WorkflowEvent(2, "a", WorkflowEventType.STARTED, "analyst", null, 102L),
                            new WorkflowEvent(3, "a", WorkflowEventType.COMPLETED, "analyst", null, 120L),
                            new WorkflowEvent(4, "b", WorkflowEventType.READY, null, null, 121L),
                            new WorkflowEvent(5, "b", WorkflowEventType.STARTED, "coder", null, 122L),
                            new WorkflowEvent(6, "b", WorkflowEventType.FAILED, "coder", "compiler missing", 170L)
                    )
            );
            new JdbcWorkflowStore(db, 16).save(view);

            JdbcWorkflowStore reopened = new JdbcWorkflowStore(db, 16);
            WorkflowView loaded = reopened.find("wf_1").orElseThrow();
            Assertions.assertEquals(view, loaded);
            Assertions.assertEquals(loaded, reopened.find("wf_1").orElseThrow());
            Assertions.assertTrue(reopened.find("wf_missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void upsertListAndRetention() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-test-jdbc-retention-");
        try {
            Database db = new Database(AgentMeshConfig.fromRoot(root.toString()));
            db.init();
            JdbcWorkflowStore store = new JdbcWorkflowStore(db, 2);

            store.save(InMemoryWorkflowStoreTest.view("wf_running", WorkflowStatus.RUNNING, 1L));
            store.save(InMemoryWorkflowStoreTest.view("wf_done", WorkflowStatus.COMPLETED, 2L));
            store.save(InMemoryWorkflowStoreTest.view("wf_failed", WorkflowStatus.FAILED, 3L));

            List<WorkflowSummary> all = store.list(null);
            Assertions.assertEquals(List.of("wf_failed", "wf_running"), all.stream().map(WorkflowSummary::id).toList());

            store.save(InMemoryWorkflowStoreTest.view("wf_running", WorkflowStatus.COMPLETED, 1L));
            Assertions.assertEquals(WorkflowStatus.COMPLETED, store.find("wf_running").orElseThrow().status());
            Assertions.assertEquals(List.of("wf_running"),
                    store.list(WorkflowStatus.COMPLETED).stream().map(WorkflowSummary::id).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
