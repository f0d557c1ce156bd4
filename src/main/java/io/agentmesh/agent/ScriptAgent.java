package io.agentmesh.agent;

import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentResponse;
import io.agentmesh.model.Capability;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * System agent that pipes the query to an external command and answers with its output.
 */
public final class ScriptAgent extends AbstractAgent {
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptAgent(String id, Set<Capability> capabilities, List<String> command, long timeoutMs) {
        super(id, AgentKind.SYSTEM, capabilities);
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + id);
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    public List<String> command() {
        return command;
    }

    @Override
    public AgentResponse process(String query, Map<String, Object> context) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return AgentResponse.fail("script spawn failed: " + e.getMessage());
        }

        try {
            byte[] input = query == null ? new byte[0] : query.getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return AgentResponse.fail("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return AgentResponse.ok(combined.strip(), Map.of("exit_code", 0, "agent_id", id()));
            }
            return AgentResponse.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (IOException e) {
            process.destroyForcibly();
            return AgentResponse.fail("script execution failed: " + e.getMessage());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
