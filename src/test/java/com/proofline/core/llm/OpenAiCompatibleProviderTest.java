package com.proofline.core.llm;

import com.proofline.core.model.AiModelConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.openai.OpenAiChatOptions;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OpenAiCompatibleProviderTest {

    private ModelLookupClient lookupClient;
    private OpenAiCompatibleProvider provider;

    @BeforeEach
    void setUp() {
        lookupClient = mock(ModelLookupClient.class);
        provider = new OpenAiCompatibleProvider("OpenAI", "https://api.openai.com",
                "/v1/chat/completions", "/v1/models", true, "Return JSON.",
                new PassthroughCredentialDecryptor(), lookupClient);
    }

    private static AiModelConfig model(String name, String key, String baseUrl) {
        return new AiModelConfig(1L, "OpenAI", name, key, baseUrl, 0.2, 2000, null);
    }

    @Test
    @DisplayName("checkModel asks the models endpoint with a bearer key")
    void lookupFound() {
        when(lookupClient.lookup(anyString(), anyMap())).thenReturn(ModelLookupClient.Result.FOUND);

        assertTrue(provider.checkModel(model("my-finetune", "sk-1", null)));

        verify(lookupClient).lookup("https://api.openai.com/v1/models/my-finetune",
                Map.of("Authorization", "Bearer sk-1"));
    }

    @Test
    @DisplayName("a 404 rejects the model even when it is on the allow-list")
    void lookupNotFound() {
        when(lookupClient.lookup(anyString(), anyMap())).thenReturn(ModelLookupClient.Result.NOT_FOUND);

        assertFalse(provider.checkModel(model("gpt-4o", "sk-1", null)));
    }

    @Test
    @DisplayName("an unverifiable lookup falls back to the allow-list")
    void lookupUnverifiable() {
        when(lookupClient.lookup(anyString(), anyMap())).thenReturn(ModelLookupClient.Result.UNVERIFIABLE);

        assertTrue(provider.checkModel(model("gpt-4o-mini", "sk-1", null)));
        assertFalse(provider.checkModel(model("text-davinci-003", "sk-1", null)));
    }

    @Test
    @DisplayName("a missing key makes the model unavailable without any lookup")
    void missingKey() {
        assertFalse(provider.checkModel(model("gpt-4o", "  ", null)));
        assertThrows(AiProviderException.class,
                () -> provider.buildRequest(model("gpt-4o", null, null), "p", RequestOptions.none()));
        verifyNoInteractions(lookupClient);
    }

    @Test
    @DisplayName("a model base URL replaces the provider default")
    void baseUrlOverride() {
        assertEquals("http://localhost:8080", provider.baseUrl(model("m", "k", "http://localhost:8080/")));
        assertEquals("https://api.openai.com", provider.baseUrl(model("m", "k", " ")));
    }

    @Test
    @DisplayName("request carries system message, JSON mode and completion token limit")
    void buildRequest() {
        AiRequest request = provider.buildRequest(model("gpt-4o", "sk-1", null), "Fix these",
                new RequestOptions(0.1, 500, "You are a proofreader."));

        List<Message> messages = request.prompt().getInstructions();
        assertEquals(2, messages.size());
        assertEquals(MessageType.SYSTEM, messages.get(0).getMessageType());
        assertEquals("Fix these", messages.get(1).getText());

        OpenAiChatOptions options = (OpenAiChatOptions) request.prompt().getOptions();
        assertEquals("gpt-4o", options.getModel());
        assertEquals(0.1, options.getTemperature());
        assertEquals(500, options.getMaxCompletionTokens());
        assertNotNull(options.getResponseFormat());
        assertEquals("OpenAI", request.provider());
    }
}
