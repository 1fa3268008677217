package com.javis.orchestrator;

import com.javis.agents.Agent;
import com.javis.agents.AgentRegistry;
import com.javis.agents.CancellationToken;
import com.javis.memory.MemoryStore;
import com.javis.observability.OrchestratorMetrics;
import com.javis.shared.config.OrchestratorConfig;
import com.javis.shared.model.ErrorKind;
import com.javis.shared.model.Result;
import com.javis.shared.model.Task;
import com.javis.shared.model.TaskError;
import com.javis.shared.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority queue drained by a fixed pool of workers.
 *
 * <p>All queue mutation and task status transitions happen under {@link #lock}.
 * Agents run outside it, and result futures are completed outside it so that
 * callbacks (workflow steps in particular) may submit again freely.
 *
 * <p>A failed attempt moves on to the next ranked candidate agent right away;
 * once the candidates are used up the last one is retried after a doubling
 * backoff. The attempt ceiling counts every attempt, the first included.
 */
public class DefaultTaskOrchestrator implements TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultTaskOrchestrator.class);
    private static final int SUMMARY_LIMIT = 500;

    private static final Comparator<TaskExecution> DISPATCH_ORDER =
            Comparator.<TaskExecution>comparingInt(e -> e.task.priority().ordinal()).reversed()
                    .thenComparingLong(e -> e.sequence);

    private final AgentRegistry registry;
    private final MemoryStore memoryStore;
    private final OrchestratorConfig config;
    private final RetryPolicy retryPolicy;
    private final OrchestratorMetrics metrics;
    private final TaskHistory history;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    private final Condition drained = lock.newCondition();
    private final PriorityQueue<TaskExecution> queue = new PriorityQueue<>(DISPATCH_ORDER);
    private final Map<String, TaskExecution> active = new HashMap<>();
    private long nextSequence;
    private int running;
    private boolean closed;

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;

    public DefaultTaskOrchestrator(AgentRegistry registry, MemoryStore memoryStore, OrchestratorConfig config) {
        this(registry, memoryStore, config, new OrchestratorMetrics());
    }

    /**
     * @param memoryStore receives a summary of every successful task; may be null
     */
    public DefaultTaskOrchestrator(AgentRegistry registry, MemoryStore memoryStore,
                                   OrchestratorConfig config, OrchestratorMetrics metrics) {
        this.registry = registry;
        this.memoryStore = memoryStore;
        this.config = config;
        this.retryPolicy = RetryPolicy.from(config);
        this.metrics = metrics;
        this.history = new TaskHistory(config.retention());

        this.workers = Executors.newFixedThreadPool(config.maxConcurrency(), namedThreads("javis-worker"));
        for (int i = 0; i < config.maxConcurrency(); i++) {
            workers.execute(this::workerLoop);
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("javis-scheduler"));
        long sweep = Math.max(1, config.retentionMinutes());
        scheduler.scheduleAtFixedRate(this::purgeHistory, sweep, sweep, TimeUnit.MINUTES);
        log.info("Orchestrator started: {} workers, retry ceiling {}", config.maxConcurrency(), config.retryCeiling());
    }

    @Override
    public Result submit(Task task) {
        return submit(task, config.defaultTimeout());
    }

    @Override
    public Result submit(Task task, Duration timeout) {
        var future = submitAsync(task, timeout);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(task.id());
            return future.getNow(Result.failure(task.id(), ErrorKind.CANCELLED, "Interrupted while waiting"));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task " + task.id() + " completed exceptionally", e.getCause());
        }
    }

    @Override
    public CompletableFuture<Result> submitAsync(Task task) {
        return submitAsync(task, config.defaultTimeout());
    }

    @Override
    public CompletableFuture<Result> submitAsync(Task task, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        Result immediate;
        lock.lock();
        try {
            if (task.status() != TaskStatus.PENDING || active.containsKey(task.id())) {
                throw new IllegalStateException("Task " + task.id() + " was already submitted");
            }
            metrics.submitted().increment();
            if (closed) {
                task.cancel();
                immediate = Result.failure(task.id(), ErrorKind.CANCELLED, "Orchestrator is closed");
                recordFinished(task, immediate);
            } else {
                var candidates = registry.find(task.requiredCapability(), task.type());
                if (candidates.isEmpty()) {
                    task.giveUp();
                    var message = task.requiredCapability() == null
                            ? "No agent accepts task type '" + task.type() + "'"
                            : "No agent with capability '" + task.requiredCapability()
                                    + "' accepts task type '" + task.type() + "'";
                    immediate = Result.failure(task.id(), ErrorKind.NO_CAPABLE_AGENT, message);
                    recordFinished(task, immediate);
                    log.warn("Task {} rejected: {}", task.id(), message);
                } else {
                    var execution = new TaskExecution(task, candidates, nextSequence++);
                    active.put(task.id(), execution);
                    enqueue(execution);
                    execution.deadline = scheduler.schedule(
                            () -> expire(execution, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
                    log.debug("Queued {} with {} candidate agent(s)", task, candidates.size());
                    return execution.future;
                }
            }
        } finally {
            lock.unlock();
        }
        return CompletableFuture.completedFuture(immediate);
    }

    @Override
    public List<Result> submitAll(List<Task> tasks) {
        var futures = tasks.stream().map(this::submitAsync).toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    @Override
    public List<Result> runWorkflow(Workflow workflow) {
        return new WorkflowRunner(this).run(workflow);
    }

    @Override
    public boolean cancel(String taskId) {
        return terminate(taskId, ErrorKind.CANCELLED, "Task cancelled");
    }

    @Override
    public Optional<Task> find(String taskId) {
        lock.lock();
        try {
            var execution = active.get(taskId);
            if (execution != null) return Optional.of(execution.task);
        } finally {
            lock.unlock();
        }
        return history.find(taskId);
    }

    @Override
    public OrchestratorStatus status() {
        lock.lock();
        try {
            return new OrchestratorStatus(queue.size(), running, active.size(), history.size(),
                    registry.size(), config.maxConcurrency(), closed,
                    (long) metrics.succeeded().count(), (long) metrics.failed().count(),
                    (long) metrics.cancelled().count());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting work, lets in-flight tasks finish within the shutdown
     * grace period, then cancels whatever is left and stops the threads.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            long remaining = TimeUnit.SECONDS.toNanos(config.shutdownGraceSeconds());
            while (!active.isEmpty() && remaining > 0) {
                remaining = drained.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }

        List<String> leftovers;
        lock.lock();
        try {
            leftovers = new ArrayList<>(active.keySet());
        } finally {
            lock.unlock();
        }
        if (!leftovers.isEmpty()) log.warn("Shutting down with {} unfinished task(s)", leftovers.size());
        for (var id : leftovers) {
            terminate(id, ErrorKind.CANCELLED, "Orchestrator shut down");
        }

        workers.shutdownNow();
        scheduler.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Orchestrator stopped");
    }

    private void workerLoop() {
        while (true) {
            TaskExecution execution;
            Agent agent;
            lock.lock();
            try {
                while (queue.isEmpty()) {
                    workAvailable.await();
                }
                execution = queue.poll();
                agent = execution.candidates.get(execution.candidateIndex);
                execution.task.start();
                execution.token = new CancellationToken();
                execution.agentId = agent.id();
                running++;
            } catch (InterruptedException e) {
                return;
            } finally {
                lock.unlock();
            }
            runAttempt(execution, agent);
            if (Thread.interrupted()) {
                if (isClosed()) return;
                log.warn("Worker {} was interrupted outside shutdown, keeping it alive", Thread.currentThread().getName());
            }
        }
    }

    private boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private void runAttempt(TaskExecution execution, Agent agent) {
        var task = execution.task;
        Result outcome = null;
        TaskError error = null;
        log.debug("Running {} on agent {} (attempt {})", task.id(), agent.id(), task.attempts() + 1);
        try {
            outcome = agent.execute(task, execution.token);
            if (outcome == null) {
                error = new TaskError(ErrorKind.AGENT_EXECUTION, "Agent " + agent.id() + " returned no result");
            } else if (!outcome.success()) {
                error = outcome.error() != null ? outcome.error()
                        : new TaskError(ErrorKind.AGENT_EXECUTION, "Agent " + agent.id() + " reported failure");
            }
        } catch (CancellationException e) {
            error = new TaskError(ErrorKind.CANCELLED, "Agent " + agent.id() + " stopped: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = new TaskError(ErrorKind.AGENT_EXECUTION, "Agent " + agent.id() + " was interrupted");
        } catch (Throwable t) {
            // an Error from agent code must not take the worker thread down with it
            log.warn("Agent {} failed on task {}: {}", agent.id(), task.id(), t.toString());
            error = new TaskError(ErrorKind.AGENT_EXECUTION, "Agent " + agent.id() + " failed: " + describe(t));
        }

        Result terminal = null;
        lock.lock();
        try {
            running--;
            if (task.isDone()) {
                // cancelled or timed out while the agent was busy
                log.debug("Discarding late result of {} from agent {}", task.id(), agent.id());
                return;
            }
            var elapsed = execution.elapsed();
            if (error == null) {
                task.succeed();
                terminal = outcome.withTaskId(task.id()).withExecution(elapsed, task.attempts() + 1, agent.id());
            } else {
                task.failAttempt();
                if (retryPolicy.exhausted(task.attempts())) {
                    task.giveUp();
                    var finalError = retryPolicy.ceiling() > 1
                            ? new TaskError(ErrorKind.RETRY_EXHAUSTED,
                                    "Gave up after " + task.attempts() + " attempts", error)
                            : error;
                    terminal = new Result(task.id(), false, Map.of(), finalError, elapsed, task.attempts(), agent.id());
                    log.warn("Task {} failed: {}", task.id(), finalError);
                } else {
                    metrics.retried().increment();
                    scheduleRetry(execution, error);
                }
            }
        } finally {
            lock.unlock();
        }

        if (terminal == null) return;
        if (terminal.success()) rememberExchange(task, terminal);
        complete(execution, terminal);
    }

    /** Caller holds the lock. */
    private void scheduleRetry(TaskExecution execution, TaskError error) {
        var task = execution.task;
        if (execution.candidateIndex + 1 < execution.candidates.size()) {
            execution.candidateIndex++;
            log.info("Task {} failed on {} ({}), trying {}", task.id(), execution.agentId, error.message(),
                    execution.candidates.get(execution.candidateIndex).id());
            enqueue(execution);
            return;
        }
        long delay = retryPolicy.delayMs(task.attempts());
        log.info("Task {} failed on {} ({}), retrying in {} ms", task.id(), execution.agentId, error.message(), delay);
        scheduler.schedule(() -> {
            lock.lock();
            try {
                if (!task.isDone()) enqueue(execution);
            } finally {
                lock.unlock();
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    private void expire(TaskExecution execution, Duration timeout) {
        if (terminate(execution.task.id(), ErrorKind.TIMEOUT, "Task timed out after " + timeout.toMillis() + " ms")) {
            log.warn("Task {} timed out after {}", execution.task.id(), timeout);
        }
    }

    private boolean terminate(String taskId, ErrorKind kind, String message) {
        TaskExecution execution;
        Result result;
        lock.lock();
        try {
            execution = active.get(taskId);
            if (execution == null || !execution.task.cancel()) return false;
            queue.remove(execution);
            if (execution.token != null) execution.token.cancel();
            result = new Result(taskId, false, Map.of(), new TaskError(kind, message), execution.elapsed(),
                    execution.task.attempts(), execution.agentId);
        } finally {
            lock.unlock();
        }
        complete(execution, result);
        return true;
    }

    private void complete(TaskExecution execution, Result result) {
        lock.lock();
        try {
            if (active.remove(execution.task.id()) == null) return;
            if (execution.deadline != null) execution.deadline.cancel(false);
            recordFinished(execution.task, result);
            if (active.isEmpty()) drained.signalAll();
        } finally {
            lock.unlock();
        }
        metrics.recordLatency(result.duration());
        execution.future.complete(result);
    }

    /** Caller holds the lock. */
    private void recordFinished(Task task, Result result) {
        history.add(task);
        if (result.success()) {
            metrics.succeeded().increment();
        } else if (result.cancelled()) {
            metrics.cancelled().increment();
        } else {
            metrics.failed().increment();
        }
    }

    /** Caller holds the lock. */
    private void enqueue(TaskExecution execution) {
        queue.offer(execution);
        workAvailable.signal();
    }

    private void rememberExchange(Task task, Result result) {
        if (memoryStore == null) return;
        var metadata = new LinkedHashMap<String, Object>();
        task.payload().forEach((key, value) -> {
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                metadata.put(key, value);
            }
        });
        metadata.put("type", "task");
        metadata.put("task_type", task.type());
        metadata.put("agent", result.agentId());
        metadata.put("task_id", task.id());
        metadata.put("priority", task.priority().name());
        try {
            memoryStore.add(summarize(task, result), metadata);
        } catch (RuntimeException e) {
            log.warn("Failed to store summary of task {}: {}", task.id(), e.getMessage());
        }
    }

    private static String summarize(Task task, Result result) {
        var answer = result.data().containsKey("message")
                ? String.valueOf(result.data().get("message"))
                : result.data().toString();
        if (answer.length() > SUMMARY_LIMIT) answer = answer.substring(0, SUMMARY_LIMIT) + "...";
        return "Q: " + task.description() + "\nA: " + answer;
    }

    private void purgeHistory() {
        int dropped = history.purge();
        if (dropped > 0) log.debug("Dropped {} finished task(s) from history", dropped);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            var thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class TaskExecution {
        final Task task;
        final List<Agent> candidates;
        final long sequence;
        final long submittedNanos = System.nanoTime();
        final CompletableFuture<Result> future = new CompletableFuture<>();
        int candidateIndex;
        CancellationToken token;
        String agentId;
        ScheduledFuture<?> deadline;

        TaskExecution(Task task, List<Agent> candidates, long sequence) {
            this.task = task;
            this.candidates = candidates;
            this.sequence = sequence;
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - submittedNanos);
        }
    }
}
