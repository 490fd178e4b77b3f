package com.duelo.engine.exception;

import lombok.Getter;

@Getter
public class InsufficientCreditsException extends AgentEngineException {

    private final long required;
    private final long available;

    public InsufficientCreditsException(long required, long available) {
        super("Insufficient credits: required " + required + ", available " + available);
        this.required = required;
        this.available = available;
    }
}
