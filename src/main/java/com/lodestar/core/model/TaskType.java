package com.lodestar.core.model;

import java.util.Locale;

/**
 * The kind of coding task a context is being selected for.
 */
public enum TaskType {
    GENERAL,
    DEBUG,
    REFACTOR,
    FEATURE,
    TEST,
    DOCUMENTATION;

    /**
     * Case-insensitive parse; blank input maps to {@link #GENERAL}.
     *
     * @throws IllegalArgumentException for an unknown task type
     */
    public static TaskType fromString(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("DOCS") || normalized.equals("DOC")) {
            return DOCUMENTATION;
        }
        return TaskType.valueOf(normalized);
    }
}
