package io.agentmesh.agent;

import io.agentmesh.model.AgentKind;
import io.agentmesh.model.AgentResponse;
import io.agentmesh.model.Capability;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class BuiltInAgentsTest {

    @Test
    void echoAgentAnswersWithQueryAndMetadata() {
        EchoAgent echo = new EchoAgent();
        AgentResponse response = echo.process("hello", Map.of("b", 1, "a", 2));

        Assertions.assertTrue(response.success());
        Assertions.assertEquals("Echo: hello", response.content());
        Assertions.assertEquals("echo", response.metadata().get("agent_id"));
        Assertions.assertEquals(5, response.metadata().get("query_length"));
        Assertions.assertEquals(List.of("a", "b"), response.metadata().get("context_keys"));
        Assertions.assertEquals(AgentKind.ECHO, echo.kind());
        Assertions.assertTrue(echo.capabilities().contains(Capability.GENERAL_PROCESSING));
    }

    @Test
    void failAgentAlwaysReturnsApplicationError() {
        AgentResponse response = new FailAgent().process("anything", Map.of());
        Assertions.assertFalse(response.success());
        Assertions.assertEquals("intentional failure from fail agent", response.error());
    }
}
