package io.agentmesh.dispatch;

/**
 * @param targetAgentId set for {@link Category#DELEGATE}, otherwise null
 * @param confidence    in [0, 1]
 */
public record Classification(Category category, String targetAgentId, double confidence) {
    public Classification {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        confidence = Math.min(1.0d, Math.max(0.0d, confidence));
    }
}
