package com.javis.agents;

import java.util.Set;

/** A named group of task types an agent accepts. Used only for routing. */
public record Capability(String name, Set<String> accepts) {

    public Capability {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("capability name must not be empty");
        accepts = accepts == null ? Set.of() : Set.copyOf(accepts);
    }

    public static Capability of(String name, String... taskTypes) {
        return new Capability(name, Set.of(taskTypes));
    }

    public boolean accepts(String taskType) {
        return accepts.contains(taskType);
    }
}
