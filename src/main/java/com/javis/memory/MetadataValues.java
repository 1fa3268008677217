package com.javis.memory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata is restricted to scalars. Anything else is kept as its string form
 * so that {@code add} never rejects a caller's metadata.
 */
final class MetadataValues {

    private MetadataValues() {}

    static Map<String, Object> normalize(Map<String, ?> metadata) {
        var out = new LinkedHashMap<String, Object>();
        if (metadata == null) return out;
        metadata.forEach((key, value) -> {
            if (key == null) return;
            out.put(key, isScalar(value) ? value : String.valueOf(value));
        });
        return out;
    }

    static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    static boolean matches(Map<String, Object> metadata, Map<String, ?> filter) {
        if (filter == null || filter.isEmpty()) return true;
        for (var entry : filter.entrySet()) {
            if (!metadata.containsKey(entry.getKey())) return false;
            var actual = String.valueOf(metadata.get(entry.getKey()));
            if (!Objects.equals(actual, String.valueOf(entry.getValue()))) return false;
        }
        return true;
    }
}
