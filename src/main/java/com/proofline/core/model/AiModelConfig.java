package com.proofline.core.model;

/**
 * Model configuration row. The API key is stored encrypted and only decrypted
 * when a provider request is built.
 */
public record AiModelConfig(
    long id,
    String provider,
    String modelName,
    String apiKeyEncrypted,
    String baseUrl,
    Double temperature,
    Integer maxTokens,
    Integer maxCharInput
) {

    @Override
    public String toString() {
        return "AiModelConfig[id=" + id + ", provider=" + provider + ", modelName=" + modelName
                + ", baseUrl=" + baseUrl + ", temperature=" + temperature + ", maxTokens=" + maxTokens
                + ", maxCharInput=" + maxCharInput + "]";
    }
}
