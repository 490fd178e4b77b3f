package com.duelo.engine.provider;

import com.duelo.engine.cost.TokenCounter;
import com.duelo.engine.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Provider backed by a Spring AI {@link ChatClient}. Falls back to heuristic token counts
 * when the response carries no usage metadata.
 */
@Slf4j
public abstract class ChatClientLlmProvider implements LlmProvider {

    @Nullable
    private final ChatClient chatClient;
    private final TokenCounter tokenCounter;

    protected ChatClientLlmProvider(@Nullable ChatClient chatClient, TokenCounter tokenCounter) {
        this.chatClient = chatClient;
        this.tokenCounter = tokenCounter;
    }

    protected abstract ChatOptions options(String model, LlmParameters parameters);

    @Override
    public boolean isAvailable() {
        return chatClient != null;
    }

    @Override
    public ProviderReply generate(String prompt, String model, LlmParameters parameters) {
        if (chatClient == null) {
            throw new ProviderException("Provider " + type() + " is not configured");
        }
        ChatClient.ChatClientRequestSpec request = chatClient.prompt().options(options(model, parameters));
        if (StringUtils.hasText(parameters.systemMessage())) {
            request = request.system(parameters.systemMessage());
        }
        ChatResponse response = request.user(prompt).call().chatResponse();
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ProviderException("Provider " + type() + " returned no result for model " + model);
        }
        String text = response.getResult().getOutput().getText();
        text = text != null ? text : "";

        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        int promptTokens = reported(usage != null ? usage.getPromptTokens() : null);
        int completionTokens = reported(usage != null ? usage.getCompletionTokens() : null);
        if (promptTokens <= 0) {
            String systemMessage = parameters.systemMessage() != null ? parameters.systemMessage() : "";
            promptTokens = tokenCounter.count(systemMessage) + tokenCounter.count(prompt);
            log.debug("No prompt usage reported by {} for {}; estimated {} tokens.", type(), model, promptTokens);
        }
        if (completionTokens <= 0) {
            completionTokens = tokenCounter.count(text);
        }
        return new ProviderReply(text, promptTokens, completionTokens);
    }

    private static int reported(@Nullable Integer tokens) {
        return tokens != null ? tokens : 0;
    }
}
