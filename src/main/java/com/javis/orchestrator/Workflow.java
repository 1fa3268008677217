package com.javis.orchestrator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named DAG of steps plus a context map merged into every step's payload.
 * Validated on construction: step ids are unique, dependencies name steps of
 * this workflow and there are no cycles.
 */
public final class Workflow {

    /** Payload key under which a step receives its dependencies' result data, by step id. */
    public static final String INPUTS_KEY = "inputs";

    private final String name;
    private final Map<String, Object> context;
    private final List<WorkflowStep> steps;
    private final List<WorkflowStep> executionOrder;

    public Workflow(String name, Map<String, ?> context, List<WorkflowStep> steps) {
        this.name = name != null ? name : "workflow";
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.steps = List.copyOf(steps);
        this.executionOrder = validate(this.name, this.steps);
    }

    public static Workflow of(String name, WorkflowStep... steps) {
        return new Workflow(name, Map.of(), List.of(steps));
    }

    public String name() { return name; }
    public Map<String, Object> context() { return context; }

    /** Steps in declaration order. */
    public List<WorkflowStep> steps() { return steps; }

    /** Steps ordered so that every step comes after its dependencies; ties keep declaration order. */
    public List<WorkflowStep> executionOrder() { return executionOrder; }

    private static List<WorkflowStep> validate(String name, List<WorkflowStep> steps) {
        var byId = new LinkedHashMap<String, WorkflowStep>();
        for (var step : steps) {
            if (byId.putIfAbsent(step.id(), step) != null) {
                throw new IllegalArgumentException("Workflow '" + name + "': duplicate step id '" + step.id() + "'");
            }
        }
        var pending = new HashMap<String, Integer>();
        var dependents = new HashMap<String, List<String>>();
        for (var step : steps) {
            var deps = new HashSet<>(step.dependsOn());
            for (var dep : deps) {
                if (!byId.containsKey(dep)) {
                    throw new IllegalArgumentException("Workflow '" + name + "': step '" + step.id()
                            + "' depends on unknown step '" + dep + "'");
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(step.id());
            }
            pending.put(step.id(), deps.size());
        }

        var ready = new ArrayDeque<String>();
        for (var step : steps) {
            if (pending.get(step.id()) == 0) ready.add(step.id());
        }
        var order = new ArrayList<WorkflowStep>(steps.size());
        while (!ready.isEmpty()) {
            var id = ready.poll();
            order.add(byId.get(id));
            for (var next : dependents.getOrDefault(id, List.of())) {
                if (pending.merge(next, -1, Integer::sum) == 0) ready.add(next);
            }
        }
        if (order.size() != steps.size()) {
            var stuck = steps.stream().map(WorkflowStep::id).filter(id -> pending.get(id) > 0).toList();
            throw new IllegalArgumentException("Workflow '" + name + "': dependency cycle among " + stuck);
        }
        return List.copyOf(order);
    }

    @Override
    public String toString() {
        return "Workflow[" + name + ", steps=" + steps.stream().map(WorkflowStep::id).toList() + "]";
    }
}
