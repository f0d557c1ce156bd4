package io.agentmesh.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainVerifiesAndContinuesAcrossInstances() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            first.log(AuditLogger.AuditEvent.of("agent.registered", "agentmesh", "echo", "ok", Map.of("kind", "echo")));
            first.log(AuditLogger.AuditEvent.of("query.dispatched", "agentmesh", "query", "ok", Map.of("route", "direct")));

            AuditLogger second = new AuditLogger(file);
            Assertions.assertEquals(first.currentHash(), second.currentHash());
            second.log(AuditLogger.AuditEvent.of("workflow.finished", "agentmesh", "wf_1", "completed", Map.of("subtasks", 3)));

            AuditLogger.VerifyResult result = second.verify();
            Assertions.assertTrue(result.valid(), String.valueOf(result.reason()));
            Assertions.assertEquals(3, result.rows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperedRowBreaksChain() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file);
            logger.log(AuditLogger.AuditEvent.of("query.dispatched", "agentmesh", "query", "ok", Map.of()));
            logger.log(AuditLogger.AuditEvent.of("query.dispatched", "agentmesh", "query", "error", Map.of()));
            logger.log(AuditLogger.AuditEvent.of("query.dispatched", "agentmesh", "query", "ok", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"result\":\"error\"", "\"result\":\"ok\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyResult result = new AuditLogger(file).verify();
            Assertions.assertFalse(result.valid());
            Assertions.assertEquals(2, result.brokenAtLine());
            Assertions.assertEquals(1, result.rows());
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
