package com.proofline.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle stage of a {@link Task}.
 * <p>
 * Stages only move forward, except for the resync branch which returns the
 * task to {@link #FETCH} once the re-walk of the fetched range has finished.
 */
public enum TaskStage {
    NEW,
    FETCH,
    RESYNC,
    AI,
    EXPORT,
    DONE;

    /** Stages the sync runner may claim. */
    public static final Set<TaskStage> SYNC_ELIGIBLE = EnumSet.of(NEW, FETCH, RESYNC);

    /** Stages the correction runner may claim. */
    public static final Set<TaskStage> AI_ELIGIBLE = EnumSet.of(AI);

    /** Stages from which an operator may request a resync pass. */
    public static final Set<TaskStage> RESYNC_REQUESTABLE = EnumSet.of(FETCH, AI, EXPORT, DONE);

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStage fromDb(String value) {
        if (value == null || value.isBlank()) {
            return NEW;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // older rows spell the resync stage with an "h"
        if ("RESYNCH".equals(normalized)) {
            return RESYNC;
        }
        return TaskStage.valueOf(normalized);
    }
}
