package com.proofline.core.llm;

import com.proofline.core.model.AiModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Anthropic Messages API through Spring AI. Anthropic has no JSON response
 * mode, so the prompt instruction carries the whole constraint.
 */
@Component
public class AnthropicProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(AnthropicProvider.class);

    static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String API_VERSION = "2023-06-01";

    /** The Messages API requires max_tokens on every call. */
    static final int DEFAULT_MAX_TOKENS = 4096;

    private final CredentialDecryptor decryptor;
    private final ModelLookupClient lookupClient;

    public AnthropicProvider(CredentialDecryptor decryptor, ModelLookupClient lookupClient) {
        this.decryptor = decryptor;
        this.lookupClient = lookupClient;
    }

    @Override
    public String name() {
        return "Anthropic";
    }

    @Override
    public String jsonInstruction() {
        return "Respond only with valid JSON. Do not include explanations, markdown, "
                + "or any text before or after the JSON.";
    }

    @Override
    public boolean checkModel(AiModelConfig model) {
        String apiKey = decryptor.decrypt(model.apiKeyEncrypted());
        if (apiKey.isEmpty()) {
            log.warn("No API key configured for Anthropic model {}", model.modelName());
            return false;
        }
        String url = baseUrl(model) + "/v1/models/" + URLEncoder.encode(model.modelName(), StandardCharsets.UTF_8);
        var headers = Map.of("x-api-key", apiKey, "anthropic-version", API_VERSION);
        return switch (lookupClient.lookup(url, headers)) {
            case FOUND -> true;
            case NOT_FOUND -> {
                log.warn("Anthropic does not know model {}", model.modelName());
                yield false;
            }
            case UNVERIFIABLE -> ModelCatalog.isListed(name(), model.modelName());
        };
    }

    @Override
    public AiRequest buildRequest(AiModelConfig model, String prompt, RequestOptions options) {
        String apiKey = decryptor.decrypt(model.apiKeyEncrypted());
        if (apiKey.isEmpty()) {
            throw new AiProviderException("Missing API key for Anthropic model " + model.modelName());
        }
        AnthropicApi api = AnthropicApi.builder()
                .baseUrl(baseUrl(model))
                .apiKey(apiKey)
                .build();

        AnthropicChatOptions.Builder builder = AnthropicChatOptions.builder()
                .model(model.modelName())
                .maxTokens(options.maxTokens() != null ? options.maxTokens() : DEFAULT_MAX_TOKENS);
        if (options.temperature() != null) {
            builder.temperature(options.temperature());
        }
        AnthropicChatOptions chatOptions = builder.build();

        ChatModel chatModel = AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(chatOptions)
                .retryTemplate(ChatMessages.SINGLE_ATTEMPT)
                .build();
        Prompt chatPrompt = new Prompt(ChatMessages.of(options.systemPrompt(), prompt), chatOptions);
        return new AiRequest(name(), model.modelName(), chatModel, chatPrompt);
    }

    private static String baseUrl(AiModelConfig model) {
        String base = model.baseUrl() == null || model.baseUrl().isBlank() ? DEFAULT_BASE_URL : model.baseUrl().trim();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
