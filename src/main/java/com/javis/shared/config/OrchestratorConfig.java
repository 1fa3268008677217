package com.javis.shared.config;

import java.time.Duration;

/**
 * Scheduling limits for the orchestrator.
 *
 * @param maxConcurrency      tasks allowed in RUNNING at the same time
 * @param retryCeiling        maximum attempts per task, first attempt included
 * @param backoffMs           delay before the first retry against the same agent
 * @param maxBackoffMs        cap for the doubling backoff
 * @param timeoutSeconds      deadline applied to submissions that carry none
 * @param retentionMinutes    how long finished tasks stay queryable
 * @param shutdownGraceSeconds how long {@code close()} waits for in-flight work
 */
public record OrchestratorConfig(
    int maxConcurrency,
    int retryCeiling,
    long backoffMs,
    long maxBackoffMs,
    long timeoutSeconds,
    long retentionMinutes,
    long shutdownGraceSeconds
) {
    public OrchestratorConfig {
        if (maxConcurrency < 1) throw new IllegalArgumentException("max-concurrency must be >= 1");
        if (retryCeiling < 1) throw new IllegalArgumentException("retry-ceiling must be >= 1");
        if (backoffMs < 0 || maxBackoffMs < backoffMs) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= backoff-ms <= max-backoff-ms");
        }
        if (timeoutSeconds < 1) throw new IllegalArgumentException("timeout-seconds must be >= 1");
        if (retentionMinutes < 0) throw new IllegalArgumentException("retention-minutes must be >= 0");
        if (shutdownGraceSeconds < 0) throw new IllegalArgumentException("shutdown-grace-seconds must be >= 0");
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(4, 3, 500, 10_000, 120, 30, 10);
    }

    public Duration defaultTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public Duration retention() {
        return Duration.ofMinutes(retentionMinutes);
    }

    public OrchestratorConfig withMaxConcurrency(int value) {
        return new OrchestratorConfig(value, retryCeiling, backoffMs, maxBackoffMs,
                timeoutSeconds, retentionMinutes, shutdownGraceSeconds);
    }

    public OrchestratorConfig withRetryCeiling(int value) {
        return new OrchestratorConfig(maxConcurrency, value, backoffMs, maxBackoffMs,
                timeoutSeconds, retentionMinutes, shutdownGraceSeconds);
    }

    public OrchestratorConfig withBackoff(long base, long max) {
        return new OrchestratorConfig(maxConcurrency, retryCeiling, base, max,
                timeoutSeconds, retentionMinutes, shutdownGraceSeconds);
    }
}
