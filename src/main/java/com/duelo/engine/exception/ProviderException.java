package com.duelo.engine.exception;

public class ProviderException extends AgentEngineException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
