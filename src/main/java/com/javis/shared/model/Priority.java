package com.javis.shared.model;

import java.util.Locale;

public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public static Priority parse(String value) {
        if (value == null || value.isBlank()) return NORMAL;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
