package com.javis.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class OrchestratorMetrics {

    private final MeterRegistry registry;

    public OrchestratorMetrics() {
        this(new SimpleMeterRegistry());
    }

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter submitted() {
        return Counter.builder("javis.tasks.submitted").register(registry);
    }

    public Counter succeeded() {
        return Counter.builder("javis.tasks.succeeded").register(registry);
    }

    public Counter failed() {
        return Counter.builder("javis.tasks.failed").register(registry);
    }

    public Counter cancelled() {
        return Counter.builder("javis.tasks.cancelled").register(registry);
    }

    public Counter retried() {
        return Counter.builder("javis.tasks.retried").register(registry);
    }

    /** Submission to terminal status, whatever the outcome. */
    public Timer taskLatency() {
        return Timer.builder("javis.task.latency").register(registry);
    }

    public void recordLatency(Duration duration) {
        taskLatency().record(duration);
    }
}
