package com.javis.workflow;

import com.javis.orchestrator.Workflow;
import com.javis.orchestrator.WorkflowStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A workflow template triggered by a slash command. String values in the
 * context, step payloads and step descriptions may contain {@code ${arg}},
 * replaced by the command argument on {@link #instantiate}.
 */
public record WorkflowDefinition(
    String name,
    String trigger,
    String description,
    Map<String, Object> context,
    List<WorkflowStep> steps
) {
    public static final String ARG_PLACEHOLDER = "${arg}";

    public WorkflowDefinition {
        if (trigger == null || trigger.isBlank()) throw new IllegalArgumentException("workflow trigger must not be empty");
        trigger = trigger.startsWith("/") ? trigger.substring(1) : trigger;
        name = name != null ? name : trigger;
        description = description != null ? description : name;
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        steps = List.copyOf(steps);
        // fail on bad step graphs at load time rather than on first use
        instantiate("");
    }

    public Workflow instantiate(String argument) {
        var arg = argument != null ? argument.trim() : "";
        var resolved = new ArrayList<WorkflowStep>(steps.size());
        for (var step : steps) {
            resolved.add(new WorkflowStep(step.id(), step.taskType(), step.requiredCapability(), step.priority(),
                    step.description() != null ? substitute(step.description(), arg) : null,
                    substituteAll(step.payload(), arg), step.dependsOn()));
        }
        return new Workflow(name, substituteAll(context, arg), resolved);
    }

    private static Map<String, Object> substituteAll(Map<String, Object> values, String arg) {
        var out = new LinkedHashMap<String, Object>();
        values.forEach((key, value) -> out.put(key, substituteValue(value, arg)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object substituteValue(Object value, String arg) {
        if (value instanceof String s) return substitute(s, arg);
        if (value instanceof Map<?, ?> m) return substituteAll((Map<String, Object>) m, arg);
        if (value instanceof List<?> l) return l.stream().map(v -> substituteValue(v, arg)).toList();
        return value;
    }

    private static String substitute(String text, String arg) {
        return text.replace(ARG_PLACEHOLDER, arg);
    }
}
