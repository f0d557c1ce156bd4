package io.agentmesh.dispatch;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

public final class DefaultDirectResponder implements DirectResponder {
    private final String name;
    private final Supplier<List<String>> agentIds;

    public DefaultDirectResponder(String name, Supplier<List<String>> agentIds) {
        this.name = name;
        this.agentIds = agentIds;
    }

    @Override
    public String respond(String query, Map<String, Object> context) {
        String text = query == null ? "" : query.trim();
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("hello") || lower.equals("hi") || lower.startsWith("hi ") || lower.startsWith("hey") || lower.startsWith("good ")) {
            return "Hello, I am " + name + ". How can I help you today?";
        }
        if (lower.contains("help") || lower.contains("what can you do")) {
            return "I am " + name + ". I can answer directly, delegate to an agent or run a multi-step workflow. "
                    + "Registered agents: " + String.join(", ", agentIds.get()) + ".";
        }
        if (lower.contains("who are you")) {
            return "I am " + name + ", a coordinator for specialized agents.";
        }
        if (lower.contains("thank")) {
            return "You're welcome.";
        }
        if (!text.isEmpty() && text.length() < 20) {
            return "Understood. " + text;
        }
        return "I am not sure how to handle that request directly.";
    }
}
