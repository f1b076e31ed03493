package com.proofline.core.reconcile;

import com.proofline.core.model.TaskValidationException;

/**
 * The model's reply is not a JSON array of objects.
 */
public class ResponseFormatException extends TaskValidationException {
    public ResponseFormatException(String message) {
        super(message);
    }

    public ResponseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
