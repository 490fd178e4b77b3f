package com.duelo.engine.exception;

import java.util.UUID;

public class AgentNotFoundException extends AgentEngineException {

    public AgentNotFoundException(UUID agentId) {
        super("Agent not found: " + agentId);
    }
}
