package com.duelo.engine.provider;

import com.duelo.config.AgentEngineProperties;
import com.duelo.engine.cost.TokenCounter;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class GoogleGenAiLlmProvider extends ChatClientLlmProvider {

    public GoogleGenAiLlmProvider(ObjectProvider<GoogleGenAiChatModel> chatModelProvider, TokenCounter tokenCounter,
                                  AgentEngineProperties properties) {
        super(buildClient(chatModelProvider.getIfAvailable(), properties.getGoogle().isEnabled()), tokenCounter);
    }

    private static ChatClient buildClient(GoogleGenAiChatModel chatModel, boolean enabled) {
        return enabled && chatModel != null ? ChatClient.builder(chatModel).build() : null;
    }

    @Override
    public ProviderType type() {
        return ProviderType.GOOGLE;
    }

    @Override
    protected ChatOptions options(String model, LlmParameters parameters) {
        return ChatOptions.builder()
                .model(model)
                .temperature(parameters.temperature())
                .maxTokens(parameters.maxTokens())
                .build();
    }
}
