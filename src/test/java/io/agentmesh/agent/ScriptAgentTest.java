package io.agentmesh.agent;

import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentResponse;
import io.agentmesh.model.Capability;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.Map;
import java.util.Set;

@DisabledOnOs(OS.WINDOWS)
final class ScriptAgentTest {

    @Test
    void pipesQueryThroughCommand() throws Exception {
        ScriptAgent agent = new ScriptAgent("cat", Set.of(Capability.SYSTEM_OPERATIONS), List.of("cat"), 5_000L);
        AgentResponse response = agent.process("list files", Map.of());

        Assertions.assertTrue(response.success());
        Assertions.assertEquals("list files", response.content());
        Assertions.assertEquals(0, response.metadata().get("exit_code"));
        Assertions.assertEquals(AgentKind.SYSTEM, agent.kind());
    }

    @Test
    void nonZeroExitIsApplicationError() throws Exception {
        ScriptAgent agent = new ScriptAgent("boom", Set.of(Capability.SYSTEM_OPERATIONS),
                List.of("sh", "-c", "echo broken; exit 3"), 5_000L);
        AgentResponse response = agent.process("", Map.of());

        Assertions.assertFalse(response.success());
        Assertions.assertTrue(response.error().startsWith("script exit=3"), response.error());
        Assertions.assertTrue(response.error().contains("broken"));
    }

    @Test
    void missingBinaryIsApplicationError() throws Exception {
        ScriptAgent agent = new ScriptAgent("missing", Set.of(Capability.SYSTEM_OPERATIONS),
                List.of("/definitely/not/a/binary"), 5_000L);
        AgentResponse response = agent.process("x", Map.of());

        Assertions.assertFalse(response.success());
        Assertions.assertTrue(response.error().startsWith("script spawn failed"));
    }
}
