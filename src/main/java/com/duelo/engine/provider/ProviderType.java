package com.duelo.engine.provider;

public enum ProviderType {
    OPENAI,
    GOOGLE,
    MOCK
}
