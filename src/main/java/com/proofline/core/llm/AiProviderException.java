package com.proofline.core.llm;

/**
 * A model provider is unknown, misconfigured, unreachable or rejected the call.
 */
public class AiProviderException extends RuntimeException {
    public AiProviderException(String message) {
        super(message);
    }

    public AiProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
