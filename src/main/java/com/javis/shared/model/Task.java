package com.javis.shared.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A unit of work routed to an agent by its {@link #type()}.
 *
 * <p>Identity, type, priority and payload are fixed at creation. Status and
 * attempt count are driven by the orchestrator through the transition methods
 * below, which reject moves the task state machine does not allow:
 * <pre>
 * PENDING -> RUNNING -> SUCCEEDED | FAILED
 * FAILED  -> RUNNING            (retry)
 * any non-terminal -> CANCELLED
 * </pre>
 */
public final class Task {

    private final String id;
    private final String type;
    private final Priority priority;
    private final Map<String, Object> payload;
    private final String description;
    private final String requiredCapability;
    private final Instant createdAt;

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile int attempts;
    private volatile Instant finishedAt;

    public Task(String type, Priority priority, Map<String, ?> payload,
                String description, String requiredCapability) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("task type must not be empty");
        }
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.priority = priority != null ? priority : Priority.NORMAL;
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.description = description != null ? description : type;
        this.requiredCapability = requiredCapability;
        this.createdAt = Instant.now();
    }

    public Task(String type, Priority priority, Map<String, ?> payload) {
        this(type, priority, payload, null, null);
    }

    public static Task of(String type, Priority priority) {
        return new Task(type, priority, Map.of());
    }

    public String id() { return id; }
    public String type() { return type; }
    public Priority priority() { return priority; }
    public Map<String, Object> payload() { return payload; }
    public String description() { return description; }
    public String requiredCapability() { return requiredCapability; }
    public Instant createdAt() { return createdAt; }
    public TaskStatus status() { return status; }
    public int attempts() { return attempts; }
    public Instant finishedAt() { return finishedAt; }

    /** True once the task has reached its single terminal status. */
    public boolean isDone() {
        return finishedAt != null;
    }

    public synchronized void start() {
        requireNotDone();
        if (status != TaskStatus.PENDING && status != TaskStatus.FAILED) {
            throw illegal(TaskStatus.RUNNING);
        }
        status = TaskStatus.RUNNING;
    }

    public synchronized void succeed() {
        requireNotDone();
        if (status != TaskStatus.RUNNING) throw illegal(TaskStatus.SUCCEEDED);
        status = TaskStatus.SUCCEEDED;
        finishedAt = Instant.now();
    }

    /** Records a failed attempt. The task stays retryable until {@link #giveUp()}. */
    public synchronized void failAttempt() {
        requireNotDone();
        if (status != TaskStatus.RUNNING) throw illegal(TaskStatus.FAILED);
        status = TaskStatus.FAILED;
        attempts++;
    }

    /** Terminal failure, either after exhausted retries or before any attempt. */
    public synchronized void giveUp() {
        requireNotDone();
        if (status == TaskStatus.RUNNING) throw illegal(TaskStatus.FAILED);
        status = TaskStatus.FAILED;
        finishedAt = Instant.now();
    }

    /** @return false if the task had already finished */
    public synchronized boolean cancel() {
        if (isDone()) return false;
        status = TaskStatus.CANCELLED;
        finishedAt = Instant.now();
        return true;
    }

    private void requireNotDone() {
        if (isDone()) {
            throw new IllegalStateException("Task " + id + " already finished as " + status);
        }
    }

    private IllegalStateException illegal(TaskStatus target) {
        return new IllegalStateException("Task " + id + ": illegal transition " + status + " -> " + target);
    }

    @Override
    public String toString() {
        return "Task[" + id + ", type=" + type + ", priority=" + priority
                + ", status=" + status + ", attempts=" + attempts + "]";
    }
}
