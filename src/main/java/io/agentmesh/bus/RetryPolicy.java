package io.agentmesh.bus;

import io.agentmesh.config.MeshSettings;

/**
 * Caller-side retry for {@link MessageBus#sendAndAwait}. Attempt {@code n} gets a deadline of
 * {@code base * multiplier^(n-1)}; there is no pause between attempts.
 */
public record RetryPolicy(int maxAttempts, double backoffMultiplier) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMultiplier < 1.0d) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(MeshSettings.DEFAULT_RETRY_ATTEMPTS, MeshSettings.DEFAULT_BACKOFF_MULTIPLIER);
    }

    public static RetryPolicy from(MeshSettings settings) {
        return new RetryPolicy(settings.retryAttempts(), settings.backoffMultiplier());
    }

    public long timeoutForAttempt(long baseTimeoutMs, int attempt) {
        int exponent = Math.max(0, attempt - 1);
        return Math.round(baseTimeoutMs * Math.pow(backoffMultiplier, exponent));
    }
}
