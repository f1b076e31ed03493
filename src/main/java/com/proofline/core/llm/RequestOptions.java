package com.proofline.core.llm;

/**
 * Per-call overrides. A non-null, non-empty value wins over the model's configured default.
 */
public record RequestOptions(Double temperature, Integer maxTokens, String systemPrompt) {

    public static RequestOptions none() {
        return new RequestOptions(null, null, null);
    }
}
