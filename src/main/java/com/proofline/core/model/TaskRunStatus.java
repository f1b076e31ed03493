package com.proofline.core.model;

import java.util.Locale;

/**
 * Claim state of a task row. {@link #RUNNING} marks a task owned by an invocation.
 */
public enum TaskRunStatus {
    IDLE,
    RUNNING,
    ERROR;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskRunStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return IDLE;
        }
        return TaskRunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
