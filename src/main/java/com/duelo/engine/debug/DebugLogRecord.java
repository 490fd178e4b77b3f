package com.duelo.engine.debug;

import com.duelo.entity.AgentType;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * One provider round trip as captured for debugging.
 */
@Builder
public record DebugLogRecord(
        AgentType operationType,
        @Nullable UUID userId,
        @Nullable UUID agentId,
        @Nullable UUID contestId,
        String model,
        Map<String, Object> strategyInput,
        String prompt,
        String response,
        @Nullable Object parsedOutput,
        long executionTimeMs,
        int promptTokens,
        int completionTokens,
        @Nullable BigDecimal costUsd
) {
}
