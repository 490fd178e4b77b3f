package com.duelo.engine.exception;

public class InvalidExecutionRequestException extends AgentEngineException {

    public InvalidExecutionRequestException(String message) {
        super(message);
    }
}
