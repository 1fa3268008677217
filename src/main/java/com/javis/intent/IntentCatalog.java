package com.javis.intent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class IntentCatalog {

    private final Map<String, IntentDefinition> byLabel = new LinkedHashMap<>();

    public IntentCatalog(List<IntentDefinition> definitions) {
        for (var def : definitions) {
            if (byLabel.putIfAbsent(def.label(), def) != null) {
                throw new IllegalArgumentException("Duplicate intent label: " + def.label());
            }
        }
    }

    /** Definitions in declaration order, which is also fallback precedence. */
    public List<IntentDefinition> definitions() {
        return List.copyOf(byLabel.values());
    }

    public Optional<IntentDefinition> get(String label) {
        return Optional.ofNullable(byLabel.get(label));
    }

    public int size() {
        return byLabel.size();
    }
}
