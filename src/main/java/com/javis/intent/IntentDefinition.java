package com.javis.intent;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One catalog entry. {@code patterns} drive the deterministic fallback and
 * {@code slots} map a slot name to a pattern whose first group is the value.
 */
public record IntentDefinition(
    String label,
    List<String> examples,
    List<Pattern> patterns,
    Map<String, Pattern> slots
) {
    public IntentDefinition {
        if (label == null || label.isBlank()) throw new IllegalArgumentException("intent label must not be empty");
        examples = List.copyOf(examples);
        patterns = List.copyOf(patterns);
        slots = Map.copyOf(slots);
    }
}
