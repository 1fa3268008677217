package com.javis.orchestrator;

/**
 * Point-in-time view of the orchestrator.
 *
 * @param queued    tasks waiting for a worker, retries included
 * @param running   tasks whose agent is executing right now
 * @param active    submitted tasks not yet terminal
 * @param retained  finished tasks still queryable through {@code find}
 */
public record OrchestratorStatus(
    int queued,
    int running,
    int active,
    int retained,
    int agents,
    int maxConcurrency,
    boolean closed,
    long succeeded,
    long failed,
    long cancelled
) {}
