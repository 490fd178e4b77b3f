package com.duelo.engine.provider;

/**
 * Raw text returned by a provider together with the token usage it reported.
 */
public record ProviderReply(String text, int promptTokens, int completionTokens) {
}
