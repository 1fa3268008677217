package com.javis.orchestrator;

import com.javis.shared.model.Task;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Finished tasks kept for a retention window after their terminal status. */
class TaskHistory {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    TaskHistory(Duration retention) {
        this(retention, Clock.systemUTC());
    }

    TaskHistory(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    void add(Task task) {
        entries.put(task.id(), new Entry(task, clock.instant()));
    }

    Optional<Task> find(String taskId) {
        var entry = entries.get(taskId);
        if (entry == null || expired(entry, clock.instant())) return Optional.empty();
        return Optional.of(entry.task());
    }

    /** @return number of entries dropped */
    int purge() {
        var now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> expired(e, now));
        return before - entries.size();
    }

    int size() {
        return entries.size();
    }

    private boolean expired(Entry entry, Instant now) {
        return !entry.finishedAt().plus(retention).isAfter(now);
    }

    private record Entry(Task task, Instant finishedAt) {}
}
