package com.duelo.engine.cost;

import java.math.BigDecimal;

/**
 * Token counts of one call, its real provider cost in USD and the credits it is worth.
 */
public record CostBreakdown(String model, int promptTokens, int completionTokens, BigDecimal costUsd, long credits) {

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
