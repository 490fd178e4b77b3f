package com.duelo.engine.provider;

/**
 * One way of reaching a family of models. Implementations may throw on any provider fault;
 * {@link LlmGateway} turns failures into unsuccessful completions.
 */
public interface LlmProvider {

    ProviderType type();

    /**
     * Whether the underlying client is configured in this deployment.
     */
    boolean isAvailable();

    ProviderReply generate(String prompt, String model, LlmParameters parameters);
}
