package com.javis.orchestrator;

import com.javis.shared.model.Result;
import com.javis.shared.model.Task;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Routes tasks to agents and drives them to a terminal status. Routing and
 * execution problems come back as failed {@link Result}s, never as exceptions.
 */
public interface TaskOrchestrator extends AutoCloseable {

    /** Blocks until the task is terminal or the default deadline expires. */
    Result submit(Task task);

    Result submit(Task task, Duration timeout);

    CompletableFuture<Result> submitAsync(Task task);

    CompletableFuture<Result> submitAsync(Task task, Duration timeout);

    /** Runs the tasks concurrently; results come back in input order. */
    List<Result> submitAll(List<Task> tasks);

    /** One result per step, in declaration order. */
    List<Result> runWorkflow(Workflow workflow);

    /** @return false if the task is unknown or already terminal */
    boolean cancel(String taskId);

    /** Active tasks and finished ones still inside the retention window. */
    Optional<Task> find(String taskId);

    OrchestratorStatus status();

    @Override
    void close();
}
