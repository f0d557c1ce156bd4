package io.agentmesh.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic classifier. In order: explicit context override ({@code target_agent},
 * {@code category}; an unknown category is ignored), multi-step markers, configured keyword
 * routes, conversational cues. Anything unrecognized is classified direct with low confidence.
 */
public final class KeywordClassifier implements QueryClassifier {
    public static final String CONTEXT_TARGET_AGENT = "target_agent";
    public static final String CONTEXT_CATEGORY = "category";

    static final double LOW_CONFIDENCE = 0.3d;

    private static final Logger log = LoggerFactory.getLogger(KeywordClassifier.class);

    private static final List<String> MULTI_STEP_MARKERS = List.of(
            "step by step", "and then", "after that", "first,", "workflow", "plan and",
            "implement", "write a program", "write code", "research and"
    );
    private static final List<String> CONVERSATIONAL = List.of(
            "hello", "hi ", "hey", "good morning", "good afternoon", "good evening",
            "help", "what can you do", "who are you", "thanks", "thank you"
    );

    private final Map<String, String> routes;

    public KeywordClassifier(Map<String, String> routes) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (routes != null) {
            for (Map.Entry<String, String> route : routes.entrySet()) {
                if (route.getKey() != null && !route.getKey().isBlank() && route.getValue() != null) {
                    normalized.put(route.getKey().trim().toLowerCase(Locale.ROOT), route.getValue().trim());
                }
            }
        }
        this.routes = normalized;
    }

    @Override
    public Classification classify(String query, Map<String, Object> context) {
        Map<String, Object> ctx = context == null ? Map.of() : context;
        Object target = ctx.get(CONTEXT_TARGET_AGENT);
        if (target != null && !String.valueOf(target).isBlank()) {
            return new Classification(Category.DELEGATE, String.valueOf(target).trim(), 1.0d);
        }
        Object category = ctx.get(CONTEXT_CATEGORY);
        if (category != null && !String.valueOf(category).isBlank()) {
            Category forced = parseCategory(String.valueOf(category));
            if (forced != null && forced != Category.DELEGATE) {
                return new Classification(forced, null, 1.0d);
            }
        }

        String lower = (query == null ? "" : query).trim().toLowerCase(Locale.ROOT);
        for (String marker : MULTI_STEP_MARKERS) {
            if (lower.contains(marker)) {
                return new Classification(Category.MULTI_STEP, null, 0.9d);
            }
        }
        for (Map.Entry<String, String> route : routes.entrySet()) {
            if (lower.contains(route.getKey())) {
                return new Classification(Category.DELEGATE, route.getValue(), 0.8d);
            }
        }
        for (String cue : CONVERSATIONAL) {
            if (lower.equals(cue.trim()) || lower.contains(cue)) {
                return new Classification(Category.DIRECT, null, 0.9d);
            }
        }
        if (!lower.isEmpty() && lower.length() < 20 && lower.chars().noneMatch(ch -> ch == '?' || ch == '!')) {
            return new Classification(Category.DIRECT, null, 0.6d);
        }
        return new Classification(Category.DIRECT, null, LOW_CONFIDENCE);
    }

    private static Category parseCategory(String raw) {
        try {
            return Category.fromString(raw);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unknown category override: {}", raw);
            return null;
        }
    }
}
