package com.proofline.core.model;

/**
 * Schema or validation problem that is recoverable at task level: bad identifier
 * names, a missing id column, a malformed or inconsistent model response.
 */
public class TaskValidationException extends RuntimeException {
    public TaskValidationException(String message) {
        super(message);
    }

    public TaskValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
