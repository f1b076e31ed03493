package com.proofline.core.llm;

/**
 * Normalised model reply.
 *
 * @param text         content of the first generation, never null
 * @param tokensIn     prompt tokens reported by the provider, 0 when unknown
 * @param tokensOut    completion tokens reported by the provider, 0 when unknown
 * @param raw          provider response rendered for diagnostics
 * @param model        model name reported by the provider, may be null
 * @param finishReason finish reason of the first generation, may be null
 */
public record AiResponse(String text, long tokensIn, long tokensOut, String raw, String model, String finishReason) {
}
