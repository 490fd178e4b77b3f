package com.duelo.engine.exception;

import java.util.UUID;

public class ExecutionCancelledException extends AgentEngineException {

    public ExecutionCancelledException(UUID executionId) {
        super("Execution " + executionId + " was cancelled");
    }
}
