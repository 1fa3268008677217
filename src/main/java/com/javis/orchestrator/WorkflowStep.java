package com.javis.orchestrator;

import com.javis.shared.model.Priority;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of a {@link Workflow}: the task to create, optionally the capability
 * that must serve it, and the steps whose results it consumes.
 */
public record WorkflowStep(
    String id,
    String taskType,
    String requiredCapability,
    Priority priority,
    String description,
    Map<String, Object> payload,
    List<String> dependsOn
) {
    public WorkflowStep {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("step id must not be empty");
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("step '" + id + "' has no task type");
        }
        priority = priority != null ? priority : Priority.NORMAL;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static WorkflowStep of(String id, String taskType) {
        return new WorkflowStep(id, taskType, null, Priority.NORMAL, null, Map.of(), List.of());
    }

    public WorkflowStep after(String... stepIds) {
        return new WorkflowStep(id, taskType, requiredCapability, priority, description, payload, List.of(stepIds));
    }

    public WorkflowStep withPayload(Map<String, ?> values) {
        return new WorkflowStep(id, taskType, requiredCapability, priority, description,
                new LinkedHashMap<>(values), dependsOn);
    }

    public WorkflowStep requiring(String capability) {
        return new WorkflowStep(id, taskType, capability, priority, description, payload, dependsOn);
    }

    public WorkflowStep withPriority(Priority value) {
        return new WorkflowStep(id, taskType, requiredCapability, value, description, payload, dependsOn);
    }

    public WorkflowStep describedAs(String text) {
        return new WorkflowStep(id, taskType, requiredCapability, priority, text, payload, dependsOn);
    }
}
