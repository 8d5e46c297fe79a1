package com.programmersdiary.aigateway.agent;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link ChatModel} for one provider, optionally pinned to a different model than the
 * provider's default (per-job overrides).
 */
@Component
public class ChatModelFactory {

    private static final String GEMINI_OPENAI_URL = "https://generativelanguage.googleapis.com/v1beta/openai";

    public ChatModel create(ProviderConfig config, String modelOverride) {
        if (config.type() == null) {
            throw new IllegalArgumentException("Provider " + config.id() + " has no type");
        }
        var model = modelOverride != null && !modelOverride.isBlank() ? modelOverride : config.model();
        return switch (config.type()) {
            case OPENAI -> openAiCompatible(config, config.baseUrl(), model != null ? model : "gpt-4o");
            case GEMINI -> openAiCompatible(config,
                    config.baseUrl() != null ? config.baseUrl() : GEMINI_OPENAI_URL,
                    model != null ? model : "gemini-2.0-flash");
            case ANTHROPIC -> anthropic(config, model != null ? model : "claude-sonnet-4-20250514");
            case OLLAMA -> ollama(config, model != null ? model : "llama3.2");
        };
    }

    private ChatModel openAiCompatible(ProviderConfig config, String baseUrl, String model) {
        var apiBuilder = OpenAiApi.builder()
                .apiKey(config.apiKey() != null ? config.apiKey() : "unused");
        if (baseUrl != null) {
            apiBuilder.baseUrl(baseUrl);
        }
        return OpenAiChatModel.builder()
                .openAiApi(apiBuilder.build())
                .defaultOptions(OpenAiChatOptions.builder().model(model).build())
                .build();
    }

    private ChatModel anthropic(ProviderConfig config, String model) {
        var apiBuilder = AnthropicApi.builder().apiKey(config.apiKey());
        if (config.baseUrl() != null) {
            apiBuilder.baseUrl(config.baseUrl());
        }
        return AnthropicChatModel.builder()
                .anthropicApi(apiBuilder.build())
                .defaultOptions(AnthropicChatOptions.builder()
                        .model(model)
                        .maxTokens(4096)
                        .build())
                .build();
    }

    private ChatModel ollama(ProviderConfig config, String model) {
        var api = OllamaApi.builder()
                .baseUrl(config.baseUrl() != null ? config.baseUrl() : "http://localhost:11434")
                .build();
        return OllamaChatModel.builder()
                .ollamaApi(api)
                .defaultOptions(OllamaChatOptions.builder().model(model).build())
                .build();
    }
}
