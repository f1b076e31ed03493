package com.proofline.core.llm;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * A provider call ready to execute: the chat model configured for the target
 * model and the prompt (system message, user message, options).
 */
public record AiRequest(String provider, String modelName, ChatModel chatModel, Prompt prompt) {
}
