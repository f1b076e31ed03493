package com.proofline.core.source;

/**
 * A source database could not be reached or queried.
 */
public class SourceAccessException extends RuntimeException {
    public SourceAccessException(String message) {
        super(message);
    }

    public SourceAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
