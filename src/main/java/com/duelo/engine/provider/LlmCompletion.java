package com.duelo.engine.provider;

import org.springframework.lang.Nullable;

import java.math.BigDecimal;

public record LlmCompletion(
        boolean success,
        String text,
        int promptTokens,
        int completionTokens,
        BigDecimal monetaryCost,
        @Nullable String error
) {

    public static LlmCompletion succeeded(ProviderReply reply, BigDecimal monetaryCost) {
        return new LlmCompletion(true, reply.text(), reply.promptTokens(), reply.completionTokens(), monetaryCost, null);
    }

    public static LlmCompletion failed(String error) {
        return new LlmCompletion(false, "", 0, 0, BigDecimal.ZERO, error);
    }
}
