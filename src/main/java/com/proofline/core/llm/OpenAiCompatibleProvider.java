package com.proofline.core.llm;

import com.proofline.core.model.AiModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Provider speaking the OpenAI chat-completions protocol: OpenAI itself and
 * the OpenAI-compatible endpoints of DeepSeek and Google.
 * <p>
 * Requests ask for a JSON object response. A model's {@code base_url}
 * replaces the provider default; the paths stay the same.
 */
public class OpenAiCompatibleProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);

    private static final ResponseFormat JSON_OBJECT = ResponseFormat.builder()
            .type(ResponseFormat.Type.JSON_OBJECT)
            .build();

    private final String name;
    private final String defaultBaseUrl;
    private final String completionsPath;
    private final String modelsPath;
    private final boolean useMaxCompletionTokens;
    private final String jsonInstruction;
    private final CredentialDecryptor decryptor;
    private final ModelLookupClient lookupClient;

    public OpenAiCompatibleProvider(String name, String defaultBaseUrl, String completionsPath, String modelsPath,
                                    boolean useMaxCompletionTokens, String jsonInstruction,
                                    CredentialDecryptor decryptor, ModelLookupClient lookupClient) {
        this.name = name;
        this.defaultBaseUrl = defaultBaseUrl;
        this.completionsPath = completionsPath;
        this.modelsPath = modelsPath;
        this.useMaxCompletionTokens = useMaxCompletionTokens;
        this.jsonInstruction = jsonInstruction;
        this.decryptor = decryptor;
        this.lookupClient = lookupClient;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String jsonInstruction() {
        return jsonInstruction;
    }

    @Override
    public boolean checkModel(AiModelConfig model) {
        String apiKey = decryptor.decrypt(model.apiKeyEncrypted());
        if (apiKey.isEmpty()) {
            log.warn("No API key configured for {} model {}", name, model.modelName());
            return false;
        }
        String url = baseUrl(model) + modelsPath + "/" + URLEncoder.encode(model.modelName(), StandardCharsets.UTF_8);
        return switch (lookupClient.lookup(url, Map.of("Authorization", "Bearer " + apiKey))) {
            case FOUND -> true;
            case NOT_FOUND -> {
                log.warn("{} does not know model {}", name, model.modelName());
                yield false;
            }
            case UNVERIFIABLE -> {
                boolean listed = ModelCatalog.isListed(name, model.modelName());
                log.info("{} model {} could not be verified online; allow-list says {}",
                        name, model.modelName(), listed ? "supported" : "unsupported");
                yield listed;
            }
        };
    }

    @Override
    public AiRequest buildRequest(AiModelConfig model, String prompt, RequestOptions options) {
        String apiKey = decryptor.decrypt(model.apiKeyEncrypted());
        if (apiKey.isEmpty()) {
            throw new AiProviderException("Missing API key for " + name + " model " + model.modelName());
        }
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(baseUrl(model))
                .apiKey(apiKey)
                .completionsPath(completionsPath)
                .build();

        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(model.modelName())
                .responseFormat(JSON_OBJECT);
        if (options.temperature() != null) {
            builder.temperature(options.temperature());
        }
        if (options.maxTokens() != null) {
            if (useMaxCompletionTokens) {
                builder.maxCompletionTokens(options.maxTokens());
            } else {
                builder.maxTokens(options.maxTokens());
            }
        }
        OpenAiChatOptions chatOptions = builder.build();

        ChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(chatOptions)
                .retryTemplate(ChatMessages.SINGLE_ATTEMPT)
                .build();
        Prompt chatPrompt = new Prompt(ChatMessages.of(options.systemPrompt(), prompt), chatOptions);
        return new AiRequest(name, model.modelName(), chatModel, chatPrompt);
    }

    String baseUrl(AiModelConfig model) {
        String base = model.baseUrl() == null || model.baseUrl().isBlank() ? defaultBaseUrl : model.baseUrl().trim();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
