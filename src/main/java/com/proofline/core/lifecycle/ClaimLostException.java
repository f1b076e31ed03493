package com.proofline.core.lifecycle;

/**
 * The runner's claim on a task was taken over after it went stale. Thrown
 * inside a batch transaction so the displaced runner's page rolls back.
 */
public class ClaimLostException extends RuntimeException {
    public ClaimLostException(long taskId) {
        super("Claim on task " + taskId + " was taken over by another runner");
    }
}
