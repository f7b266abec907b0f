package com.kmg.pageocr.model;

import java.util.Locale;

public enum SelectionMode {
    ALL,
    RANGE,
    RESUME;

    public static SelectionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode '" + value + "'. Use all, range or resume.");
        }
    }
}
