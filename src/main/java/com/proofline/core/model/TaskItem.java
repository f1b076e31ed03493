package com.proofline.core.model;

import java.time.Instant;

/**
 * One source record under correction.
 * <p>
 * {@code remoteId} is the source identifier and {@code id} the local one; the
 * prompt and the reconciliation fall back from the former to the latter.
 */
public record TaskItem(
    Long id,
    long taskId,
    Long remoteId,
    String textOriginal,
    String originalHash,
    String textCorrected,
    TaskItemStatus status,
    Double similarityScore,
    Integer tokensInput,
    Integer tokensOutput,
    String aiModel,
    String finishReason,
    Instant fetchedAt,
    Instant processedAt
) {

    /**
     * A pending item as read for prompting: only identifiers and original text are known.
     */
    public static TaskItem pending(Long id, long taskId, Long remoteId, String textOriginal) {
        return new TaskItem(id, taskId, remoteId, textOriginal, null, null, TaskItemStatus.PENDING,
                null, null, null, null, null, null, null);
    }
}
