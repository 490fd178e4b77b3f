package com.duelo.engine.ledger;

import java.math.BigDecimal;

public record ModelUsage(String model, long operations, long credits, long tokens, BigDecimal costUsd) {
}
