package com.proofline.core.llm;

import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.retry.support.RetryTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Message list and retry policy shared by the providers.
 */
final class ChatMessages {

    /** One attempt per invocation; a failed call is retried by the next run. */
    static final RetryTemplate SINGLE_ATTEMPT = RetryTemplate.builder().maxAttempts(1).build();

    private ChatMessages() {}

    /**
     * User message, preceded by a system message only when one is configured.
     */
    static List<Message> of(String systemPrompt, String userPrompt) {
        List<Message> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(userPrompt));
        return messages;
    }
}
