package com.duelo.engine.exception;

import lombok.Getter;

@Getter
public class UnknownModelException extends AgentEngineException {

    private final String model;

    public UnknownModelException(String model) {
        super("Unknown or unavailable model: " + model);
        this.model = model;
    }
}
