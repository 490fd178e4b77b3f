package com.duelo.entity;

public enum AgentType {
    WRITER,
    JUDGE
}
