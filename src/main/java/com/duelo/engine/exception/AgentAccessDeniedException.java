package com.duelo.engine.exception;

public class AgentAccessDeniedException extends AgentEngineException {

    public AgentAccessDeniedException(String message) {
        super(message);
    }
}
