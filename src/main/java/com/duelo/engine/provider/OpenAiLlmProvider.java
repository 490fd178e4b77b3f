package com.duelo.engine.provider;

import com.duelo.config.AgentEngineProperties;
import com.duelo.engine.cost.TokenCounter;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class OpenAiLlmProvider extends ChatClientLlmProvider {

    public OpenAiLlmProvider(ObjectProvider<OpenAiChatModel> chatModelProvider, TokenCounter tokenCounter,
                             AgentEngineProperties properties) {
        super(buildClient(chatModelProvider.getIfAvailable(), properties.getOpenai().isEnabled()), tokenCounter);
    }

    private static ChatClient buildClient(OpenAiChatModel chatModel, boolean enabled) {
        return enabled && chatModel != null ? ChatClient.builder(chatModel).build() : null;
    }

    @Override
    public ProviderType type() {
        return ProviderType.OPENAI;
    }

    @Override
    protected ChatOptions options(String model, LlmParameters parameters) {
        return OpenAiChatOptions.builder()
                .model(model)
                .temperature(parameters.temperature())
                .maxTokens(parameters.maxTokens())
                .build();
    }
}
