package com.javis.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** Workflow templates by slash trigger. A later registration replaces an earlier one. */
public class WorkflowRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRegistry.class);

    private final Map<String, WorkflowDefinition> byTrigger = new LinkedHashMap<>();

    public void register(WorkflowDefinition definition) {
        if (byTrigger.put(definition.trigger(), definition) != null) {
            log.info("Workflow /{} overridden by {}", definition.trigger(), definition.name());
        }
    }

    /** @return the template whose trigger starts {@code message}, or null */
    public WorkflowDefinition match(String message) {
        if (message == null || !message.startsWith("/")) return null;
        var cmd = message.split("\\s", 2)[0].substring(1);
        return byTrigger.get(cmd);
    }

    /** Text after the trigger, empty if none. */
    public static String argument(String message) {
        var parts = message.trim().split("\\s", 2);
        return parts.length > 1 ? parts[1].trim() : "";
    }

    public Collection<WorkflowDefinition> all() {
        return byTrigger.values();
    }
}
