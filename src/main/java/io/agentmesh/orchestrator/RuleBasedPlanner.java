package io.agentmesh.orchestrator;

import io.agentmesh.model.Capability;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic keyword planner. Code requests get an analyze, implement, test chain;
 * research requests a search then summarize pair; everything else a single node.
 */
public final class RuleBasedPlanner implements Planner {
    private static final List<String> CODE_KEYWORDS = List.of(
            "code", "program", "script", "function", "python", "javascript", "java",
            "implement", "class", "refactor", "compile", "algorithm"
    );
    private static final List<String> SYSTEM_KEYWORDS = List.of(
            "system", "file", "directory", "folder", "execute", "run ", "command",
            "disk", "path", "memory usage"
    );
    private static final List<String> RESEARCH_KEYWORDS = List.of(
            "research", "investigate", "look up", "search for", "find information",
            "summarize", "summary", "compare"
    );

    @Override
    public List<SubtaskSpec> decompose(String request, Map<String, Object> context) {
        String text = request == null ? "" : request.trim();
        String lower = text.toLowerCase(Locale.ROOT);

        if (lower.startsWith("echo")) {
            return List.of(SubtaskSpec.of("echo", text, Capability.ECHO));
        }
        int codeMatches = count(lower, CODE_KEYWORDS);
        int systemMatches = count(lower, SYSTEM_KEYWORDS);
        if (codeMatches > 0 && codeMatches >= systemMatches) {
            return List.of(
                    SubtaskSpec.of("analyze", "Analyze requirements: " + text, Capability.ANALYSIS),
                    SubtaskSpec.of("implement", "Implement: " + text, Capability.CODE_GENERATION, "analyze"),
                    SubtaskSpec.of("test", "Write and run tests for: " + text, Capability.TESTING, "implement")
            );
        }
        if (count(lower, RESEARCH_KEYWORDS) > 0) {
            return List.of(
                    SubtaskSpec.of("search", "Gather sources: " + text, Capability.SEARCH),
                    SubtaskSpec.of("summarize", "Summarize findings: " + text, Capability.SUMMARIZATION, "search")
            );
        }
        if (systemMatches > 0) {
            return List.of(SubtaskSpec.of("system", text, Capability.SYSTEM_OPERATIONS));
        }
        return List.of(SubtaskSpec.of("process", text, Capability.GENERAL_PROCESSING));
    }

    private static int count(String text, List<String> keywords) {
        int matches = 0;
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                matches++;
            }
        }
        return matches;
    }
}
