package com.proofline.core.lifecycle;

import com.proofline.core.model.TaskStage;

/**
 * Counters of one task after a recount.
 */
public record ProgressSummary(
    long pending,
    long changed,
    long unchanged,
    double syncProgress,
    double aiProgress,
    TaskStage stage
) {

    public long processed() {
        return changed + unchanged;
    }
}
