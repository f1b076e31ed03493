package com.proofline.core.model;

import java.util.Locale;

/**
 * Correction state of a single {@link TaskItem}.
 */
public enum TaskItemStatus {
    PENDING,
    CHANGED,    // model returned a different text
    UNCHANGED;  // model returned an empty correction

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskItemStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return TaskItemStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
