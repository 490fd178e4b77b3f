package com.duelo.engine.provider;

import org.springframework.lang.Nullable;

public record LlmParameters(@Nullable Double temperature, @Nullable Integer maxTokens, @Nullable String systemMessage) {

    public static LlmParameters defaults() {
        return new LlmParameters(null, null, null);
    }
}
