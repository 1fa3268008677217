package com.javis.orchestrator;

import com.javis.shared.config.OrchestratorConfig;

/**
 * Attempt ceiling plus doubling backoff for retries against the same agent.
 * Retries that move on to another candidate agent are not delayed.
 */
public record RetryPolicy(int ceiling, long baseDelayMs, long maxDelayMs) {

    public RetryPolicy {
        if (ceiling < 1) throw new IllegalArgumentException("ceiling must be >= 1");
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("delay must satisfy 0 <= base <= max");
        }
    }

    public static RetryPolicy from(OrchestratorConfig config) {
        return new RetryPolicy(config.retryCeiling(), config.backoffMs(), config.maxBackoffMs());
    }

    public boolean exhausted(int attempts) {
        return attempts >= ceiling;
    }

    /** Delay before attempt {@code failedAttempts + 1}: base, 2x base, 4x base... capped. */
    public long delayMs(int failedAttempts) {
        long delay = baseDelayMs;
        for (int i = 1; i < failedAttempts && delay < maxDelayMs; i++) {
            delay = delay * 2;
        }
        return Math.min(delay, maxDelayMs);
    }
}
