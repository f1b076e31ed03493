package com.proofline.core.llm;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The OpenAI-protocol providers. Anthropic registers itself as a component.
 */
@Configuration
public class AiProviderConfig {

    @Bean
    public AiProvider openAiProvider(CredentialDecryptor decryptor, ModelLookupClient lookupClient) {
        return new OpenAiCompatibleProvider("OpenAI",
                "https://api.openai.com", "/v1/chat/completions", "/v1/models",
                true,
                "Return only valid JSON, without comments or any text around it. "
                        + "The result must be a pure JSON object.",
                decryptor, lookupClient);
    }

    @Bean
    public AiProvider deepSeekProvider(CredentialDecryptor decryptor, ModelLookupClient lookupClient) {
        return new OpenAiCompatibleProvider("DeepSeek",
                "https://api.deepseek.com/v1", "/chat/completions", "/models",
                false,
                "Return only valid JSON, without code blocks or extra text.",
                decryptor, lookupClient);
    }

    @Bean
    public AiProvider googleProvider(CredentialDecryptor decryptor, ModelLookupClient lookupClient) {
        return new OpenAiCompatibleProvider("Google",
                "https://generativelanguage.googleapis.com/v1beta/openai", "/chat/completions", "/models",
                false,
                "Output only valid JSON. No markdown, no text outside the JSON.",
                decryptor, lookupClient);
    }
}
