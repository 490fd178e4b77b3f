package com.duelo.engine.ledger;

import com.duelo.engine.cost.CostBreakdown;

import java.util.UUID;

/**
 * Everything needed to close a successful execution.
 */
public record SettlementRequest(UUID executionId, UUID userId, String description, CostBreakdown cost, boolean parsingSuccess) {
}
