package io.agentmesh.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import io.agentmesh.util.Hashing;
import io.agentmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only JSONL audit trail. Each row carries the hash of the previous row, so an
 * edited or removed line breaks the chain at that point.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-reads the whole file and recomputes every row hash and link.
     */
    public synchronized VerifyResult verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int rows = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            int lineNo = i + 1;
            Map<String, Object> row;
            try {
                row = Jsons.mapper().readValue(line, ROW_TYPE);
            } catch (IOException e) {
                return VerifyResult.broken(rows, lineNo, "unparseable row");
            }
            Object storedHash = row.remove("hash");
            if (!Objects.equals(expectedPrev, row.get("prev_hash"))) {
                return VerifyResult.broken(rows, lineNo, "prev_hash does not match previous row");
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(storedHash)) {
                return VerifyResult.broken(rows, lineNo, "row hash mismatch");
            }
            expectedPrev = recomputed;
            rows++;
        }
        return new VerifyResult(true, rows, null, null);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Could not read last audit hash from {}, starting a new chain", auditFile, e);
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public AuditEvent {
            details = details == null ? Map.of() : new LinkedHashMap<>(details);
        }

        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details);
        }
    }

    /**
     * @param brokenAtLine 1-based line of the first bad row, null when valid
     */
    public record VerifyResult(boolean valid, int rows, Integer brokenAtLine, String reason) {
        static VerifyResult broken(int rows, int line, String reason) {
            return new VerifyResult(false, rows, line, reason);
        }
    }
}
