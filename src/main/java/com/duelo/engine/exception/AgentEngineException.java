package com.duelo.engine.exception;

/**
 * Root of every failure the agent engine reports to its callers.
 */
public class AgentEngineException extends RuntimeException {

    public AgentEngineException(String message) {
        super(message);
    }

    public AgentEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
