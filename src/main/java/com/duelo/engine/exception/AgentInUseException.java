package com.duelo.engine.exception;

import java.util.UUID;

public class AgentInUseException extends AgentEngineException {

    public AgentInUseException(UUID agentId) {
        super("Agent " + agentId + " has pending or running executions");
    }
}
