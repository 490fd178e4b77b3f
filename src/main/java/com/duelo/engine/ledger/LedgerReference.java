package com.duelo.engine.ledger;

import com.duelo.engine.AgentEngineConstants;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * What a ledger movement is about.
 */
public record LedgerReference(
        String description,
        @Nullable String relatedEntityType,
        @Nullable UUID relatedEntityId,
        @Nullable String model,
        @Nullable Integer tokensUsed,
        @Nullable BigDecimal realCostUsd
) {

    public static LedgerReference forExecution(UUID executionId, String description, String model,
                                               int tokensUsed, BigDecimal realCostUsd) {
        return new LedgerReference(description, AgentEngineConstants.RELATED_ENTITY_EXECUTION, executionId,
                model, tokensUsed, realCostUsd);
    }

    public static LedgerReference note(String description) {
        return new LedgerReference(description, null, null, null, null, null);
    }
}
