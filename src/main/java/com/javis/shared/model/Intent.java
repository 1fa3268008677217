package com.javis.shared.model;

import java.util.Map;

public record Intent(String label, double confidence, Map<String, String> slots) {

    public static final String UNKNOWN = "unknown";

    public Intent {
        if (label == null || label.isBlank()) label = UNKNOWN;
        if (Double.isNaN(confidence)) confidence = 0.0;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        slots = slots == null ? Map.of() : Map.copyOf(slots);
    }

    public static Intent unknown() {
        return new Intent(UNKNOWN, 0.0, Map.of());
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(label);
    }

    /** {@link ErrorKind#CLASSIFICATION_AMBIGUOUS} for an unknown intent, otherwise null. */
    public ErrorKind errorKind() {
        return isUnknown() ? ErrorKind.CLASSIFICATION_AMBIGUOUS : null;
    }

    public String slot(String name) {
        return slots.get(name);
    }
}
