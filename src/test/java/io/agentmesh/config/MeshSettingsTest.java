package io.agentmesh.config;

import io.agentmesh.model.AgentKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class MeshSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-test-settings-missing-");
        try {
            AgentMeshConfig config = AgentMeshConfig.fromRoot(root.toString());
            MeshSettings settings = MeshSettings.load(config.settingsFile());

            Assertions.assertEquals(MeshSettings.defaults(), settings);
            Assertions.assertEquals(30_000L, settings.defaultTimeoutMs());
            Assertions.assertEquals(2, settings.retryAttempts());
            Assertions.assertEquals(1.5d, settings.backoffMultiplier());
            Assertions.assertNull(settings.fallbackAgentId());
            Assertions.assertEquals(MeshSettings.STORE_MEMORY, settings.workflowStore());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesOverrideDefaultsFieldByField() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-test-settings-file-");
        try {
            AgentMeshConfig config = AgentMeshConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "defaultTimeoutMs": 5000,
                      "timeoutOverridesMs": {"code": 60000, "system": 0},
                      "retryAttempts": 3,
                      "fallbackAgentId": "helper",
                      "workflowStore": "SQLite",
                      "routes": {"weather": "forecaster"},
                      "scriptAgents": [
                        {"id": "lister", "capabilities": ["file_management"], "command": ["ls", "-la"], "timeoutMs": 2000}
                      ],
                      "unknownField": true
                    }
                    """, StandardCharsets.UTF_8);

            MeshSettings settings = MeshSettings.load(config.settingsFile());

            Assertions.assertEquals(5_000L, settings.defaultTimeoutMs());
            Assertions.assertEquals(60_000L, settings.timeoutFor(AgentKind.CODE));
            Assertions.assertEquals(5_000L, settings.timeoutFor(AgentKind.SYSTEM));
            Assertions.assertEquals(3, settings.retryAttempts());
            Assertions.assertEquals(1.5d, settings.backoffMultiplier());
            Assertions.assertEquals("helper", settings.fallbackAgentId());
            Assertions.assertEquals(0.5d, settings.confidenceThreshold());
            Assertions.assertEquals(MeshSettings.STORE_SQLITE, settings.workflowStore());
            Assertions.assertEquals("forecaster", settings.routes().get("weather"));
            Assertions.assertEquals(1, settings.scriptAgents().size());
            Assertions.assertEquals(List.of("ls", "-la"), settings.scriptAgents().get(0).command());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-test-settings-bad-");
        try {
            Path file = root.resolve(AgentMeshConfig.SETTINGS_FILE);
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> MeshSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownStoreIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MeshSettings.defaults().withWorkflowStore("redis"));
    }

    @Test
    void configResolvesPathsUnderRoot() {
        AgentMeshConfig config = AgentMeshConfig.fromRoot("/tmp/agentmesh-root");
        Assertions.assertEquals(Path.of("/tmp/agentmesh-root/agentmesh-settings.json"), config.settingsFile());
        Assertions.assertEquals(Path.of("/tmp/agentmesh-root/audit/audit.log"), config.auditFile());
        Assertions.assertEquals(Path.of("/tmp/agentmesh-root/agentmesh.db"), config.dbFile());
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
