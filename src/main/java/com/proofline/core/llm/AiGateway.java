package com.proofline.core.llm;

import com.proofline.core.metrics.PipelineMetrics;
import com.proofline.core.model.AiModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.stereotype.Service;

/**
 * Single entry point for model calls: resolves the provider, merges request
 * options with the model's defaults, executes and normalises the reply.
 */
@Service
public class AiGateway {

    private static final Logger log = LoggerFactory.getLogger(AiGateway.class);

    private final ProviderRegistry registry;
    private final PipelineMetrics metrics;

    public AiGateway(ProviderRegistry registry, PipelineMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    public boolean checkModel(AiModelConfig model) {
        return registry.require(model.provider()).checkModel(model);
    }

    /**
     * Builds a call for {@code model}. Explicit options win over the model's
     * configured temperature and max tokens; the provider's JSON instruction is
     * appended to the prompt after a blank line.
     *
     * @throws AiProviderException for an unsupported provider or a missing API key
     */
    public AiRequest buildRequest(AiModelConfig model, String prompt, RequestOptions options) {
        AiProvider provider = registry.require(model.provider());
        RequestOptions effective = merge(model, options == null ? RequestOptions.none() : options);
        String fullPrompt = appendJsonInstruction(prompt, provider.jsonInstruction());
        return provider.buildRequest(model, fullPrompt, effective);
    }

    /**
     * @throws AiProviderException when the provider call fails or returns nothing
     */
    public AiResponse execute(AiRequest request) {
        log.info("AI call started -> {} {}", request.provider(), request.modelName());
        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = request.chatModel().call(request.prompt());
        } catch (RuntimeException e) {
            metrics.recordAiCall(request.provider(), System.currentTimeMillis() - start, false);
            throw new AiProviderException(request.provider() + " call failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordAiCall(request.provider(), elapsed, true);
        if (response == null || response.getResult() == null) {
            throw new AiProviderException(request.provider() + " returned no generation for " + request.modelName());
        }

        Generation generation = response.getResult();
        String text = generation.getOutput() == null || generation.getOutput().getText() == null
                ? "" : generation.getOutput().getText();
        String finishReason = generation.getMetadata() == null ? null : generation.getMetadata().getFinishReason();

        ChatResponseMetadata metadata = response.getMetadata();
        long tokensIn = 0;
        long tokensOut = 0;
        String model = null;
        if (metadata != null) {
            model = metadata.getModel();
            Usage usage = metadata.getUsage();
            if (usage != null) {
                tokensIn = toLong(usage.getPromptTokens());
                tokensOut = toLong(usage.getCompletionTokens());
            }
        }
        metrics.recordTokens(request.provider(), tokensIn, tokensOut);
        log.info("AI call complete -> {} ({}s, {} in / {} out tokens, finish {})", request.modelName(),
                String.format("%.1f", elapsed / 1000.0), tokensIn, tokensOut, finishReason);
        return new AiResponse(text, tokensIn, tokensOut, response.toString(), model, finishReason);
    }

    static RequestOptions merge(AiModelConfig model, RequestOptions options) {
        Double temperature = options.temperature() != null ? options.temperature() : model.temperature();
        Integer maxTokens = options.maxTokens() != null && options.maxTokens() > 0
                ? options.maxTokens() : model.maxTokens();
        String systemPrompt = options.systemPrompt() != null && !options.systemPrompt().isBlank()
                ? options.systemPrompt() : null;
        return new RequestOptions(temperature, maxTokens, systemPrompt);
    }

    static String appendJsonInstruction(String prompt, String instruction) {
        if (instruction == null || instruction.isBlank()) {
            return prompt;
        }
        String normalized = prompt == null ? "" : prompt.stripTrailing();
        if (normalized.isEmpty()) {
            return instruction;
        }
        return normalized + "\n\n" + instruction;
    }

    private static long toLong(Number value) {
        return value == null ? 0L : value.longValue();
    }
}
