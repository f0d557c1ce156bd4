package io.agentmesh.config;

import io.agentmesh.model.AgentKind;
import io.agentmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tunables consumed by the bus, orchestrator and dispatcher. Read from
 * {@code agentmesh-settings.json}; every absent field falls back to its default.
 */
public record MeshSettings(
        long defaultTimeoutMs,
        Map<String, Long> timeoutOverridesMs,
        int retryAttempts,
        double backoffMultiplier,
        String fallbackAgentId,
        double confidenceThreshold,
        int maxConcurrentSubtasks,
        int workflowRetention,
        String workflowStore,
        Map<String, String> routes,
        List<ScriptAgentSpec> scriptAgents
) {
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_RETRY_ATTEMPTS = 2;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 1.5d;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5d;
    public static final int DEFAULT_MAX_CONCURRENT_SUBTASKS = 4;
    public static final int DEFAULT_WORKFLOW_RETENTION = 256;
    public static final String STORE_MEMORY = "memory";
    public static final String STORE_SQLITE = "sqlite";

    public MeshSettings {
        timeoutOverridesMs = normalizeOverrides(timeoutOverridesMs);
        routes = routes == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(routes));
        scriptAgents = scriptAgents == null ? List.of() : List.copyOf(scriptAgents);
        fallbackAgentId = fallbackAgentId == null || fallbackAgentId.isBlank() ? null : fallbackAgentId.trim();
        workflowStore = workflowStore == null || workflowStore.isBlank()
                ? STORE_MEMORY
                : workflowStore.trim().toLowerCase(Locale.ROOT);
        if (!STORE_MEMORY.equals(workflowStore) && !STORE_SQLITE.equals(workflowStore)) {
            throw new IllegalArgumentException("Unknown workflowStore: " + workflowStore);
        }
    }

    public static MeshSettings defaults() {
        return new MeshSettings(
                DEFAULT_TIMEOUT_MS,
                Map.of(),
                DEFAULT_RETRY_ATTEMPTS,
                DEFAULT_BACKOFF_MULTIPLIER,
                null,
                DEFAULT_CONFIDENCE_THRESHOLD,
                DEFAULT_MAX_CONCURRENT_SUBTASKS,
                DEFAULT_WORKFLOW_RETENTION,
                STORE_MEMORY,
                Map.of(),
                List.of()
        );
    }

    public static MeshSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static MeshSettings fromFile(SettingsFile file, MeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new MeshSettings(
                positive(file.defaultTimeoutMs(), defaults.defaultTimeoutMs()),
                file.timeoutOverridesMs() == null ? defaults.timeoutOverridesMs() : file.timeoutOverridesMs(),
                file.retryAttempts() == null ? defaults.retryAttempts() : Math.max(1, file.retryAttempts()),
                file.backoffMultiplier() == null ? defaults.backoffMultiplier() : Math.max(1.0d, file.backoffMultiplier()),
                file.fallbackAgentId() == null ? defaults.fallbackAgentId() : file.fallbackAgentId(),
                file.confidenceThreshold() == null
                        ? defaults.confidenceThreshold()
                        : Math.min(1.0d, Math.max(0.0d, file.confidenceThreshold())),
                file.maxConcurrentSubtasks() == null ? defaults.maxConcurrentSubtasks() : Math.max(1, file.maxConcurrentSubtasks()),
                file.workflowRetention() == null ? defaults.workflowRetention() : Math.max(1, file.workflowRetention()),
                file.workflowStore() == null ? defaults.workflowStore() : file.workflowStore(),
                file.routes() == null ? defaults.routes() : file.routes(),
                file.scriptAgents() == null ? defaults.scriptAgents() : file.scriptAgents()
        );
    }

    public long timeoutFor(AgentKind kind) {
        if (kind != null) {
            Long override = timeoutOverridesMs.get(kind.wire());
            if (override != null) {
                return override;
            }
        }
        return defaultTimeoutMs;
    }

    public MeshSettings withDefaultTimeoutMs(long value) {
        return new MeshSettings(value, timeoutOverridesMs, retryAttempts, backoffMultiplier, fallbackAgentId,
                confidenceThreshold, maxConcurrentSubtasks, workflowRetention, workflowStore, routes, scriptAgents);
    }

    public MeshSettings withTimeoutOverride(AgentKind kind, long value) {
        Map<String, Long> merged = new LinkedHashMap<>(timeoutOverridesMs);
        merged.put(kind.wire(), value);
        return new MeshSettings(defaultTimeoutMs, merged, retryAttempts, backoffMultiplier, fallbackAgentId,
                confidenceThreshold, maxConcurrentSubtasks, workflowRetention, workflowStore, routes, scriptAgents);
    }

    public MeshSettings withRetry(int attempts, double multiplier) {
        return new MeshSettings(defaultTimeoutMs, timeoutOverridesMs, Math.max(1, attempts), Math.max(1.0d, multiplier),
                fallbackAgentId, confidenceThreshold, maxConcurrentSubtasks, workflowRetention, workflowStore, routes, scriptAgents);
    }

    public MeshSettings withFallbackAgentId(String value) {
        return new MeshSettings(defaultTimeoutMs, timeoutOverridesMs, retryAttempts, backoffMultiplier, value,
                confidenceThreshold, maxConcurrentSubtasks, workflowRetention, workflowStore, routes, scriptAgents);
    }

    public MeshSettings withConfidenceThreshold(double value) {
        return new MeshSettings(defaultTimeoutMs, timeoutOverridesMs, retryAttempts, backoffMultiplier, fallbackAgentId,
                value, maxConcurrentSubtasks, workflowRetention, workflowStore, routes, scriptAgents);
    }

    public MeshSettings withRoutes(Map<String, String> value) {
        return new MeshSettings(defaultTimeoutMs, timeoutOverridesMs, retryAttempts, backoffMultiplier, fallbackAgentId,
                confidenceThreshold, maxConcurrentSubtasks, workflowRetention, workflowStore, value, scriptAgents);
    }

    public MeshSettings withWorkflowRetention(int value) {
        return new MeshSettings(defaultTimeoutMs, timeoutOverridesMs, retryAttempts, backoffMultiplier, fallbackAgentId,
                confidenceThreshold, maxConcurrentSubtasks, Math.max(1, value), workflowStore, routes, scriptAgents);
    }

    public MeshSettings withWorkflowStore(String value) {
        return new MeshSettings(defaultTimeoutMs, timeoutOverridesMs, retryAttempts, backoffMultiplier, fallbackAgentId,
                confidenceThreshold, maxConcurrentSubtasks, workflowRetention, value, routes, scriptAgents);
    }

    private static long positive(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    private static Map<String, Long> normalizeOverrides(Map<String, Long> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, Long> out = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null || entry.getValue() <= 0L) {
                continue;
            }
            out.put(AgentKind.fromString(entry.getKey()).wire(), entry.getValue());
        }
        return Map.copyOf(out);
    }

    public record ScriptAgentSpec(String id, List<String> capabilities, List<String> command, Long timeoutMs) {
        public ScriptAgentSpec {
            capabilities = capabilities == null ? List.of() : new ArrayList<>(capabilities);
            command = command == null ? List.of() : new ArrayList<>(command);
        }
    }

    public record SettingsFile(
            Long defaultTimeoutMs,
            Map<String, Long> timeoutOverridesMs,
            Integer retryAttempts,
            Double backoffMultiplier,
            String fallbackAgentId,
            Double confidenceThreshold,
            Integer maxConcurrentSubtasks,
            Integer workflowRetention,
            String workflowStore,
            Map<String, String> routes,
            List<ScriptAgentSpec> scriptAgents
    ) {
    }
}
