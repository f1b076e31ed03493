package com.proofline.core.llm;

import com.proofline.core.model.AiModelConfig;

/**
 * One model vendor. Implementations are Spring beans collected into the {@link ProviderRegistry}.
 */
public interface AiProvider {

    /** Provider name as stored in {@code ai_model.provider}, e.g. "OpenAI". */
    String name();

    /** Sentence appended to every prompt asking for bare JSON output. */
    String jsonInstruction();

    /**
     * Whether the configured model can be used. Looks the model up at the
     * vendor and falls back to {@link ModelCatalog} when the vendor cannot be
     * asked; a missing API key makes the model unusable.
     */
    boolean checkModel(AiModelConfig model);

    /**
     * @param prompt  full user message, JSON instruction included
     * @param options already merged with the model's defaults
     * @throws AiProviderException when the API key is missing
     */
    AiRequest buildRequest(AiModelConfig model, String prompt, RequestOptions options);
}
