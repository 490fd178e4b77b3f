package com.duelo.engine.cost;

import com.duelo.config.AgentEngineProperties;
import com.duelo.engine.AgentEngineConstants;
import com.duelo.entity.AgentType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts token counts into USD and credits. Every credit amount is at least the configured
 * minimum and is rounded up, never down.
 */
@Service
@RequiredArgsConstructor
public class CostEstimator {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final ModelPricingCatalog pricingCatalog;
    private final TokenCounter tokenCounter;
    private final AgentEngineProperties properties;

    /**
     * Pre-call estimate for an already built prompt.
     */
    public CostBreakdown estimate(String model, String promptText, int expectedCompletionTokens) {
        return costOf(model, tokenCounter.count(promptText), Math.max(0, expectedCompletionTokens));
    }

    /**
     * Estimate for callers that only know how much context (in characters) the agent will see.
     */
    public CostBreakdown estimate(AgentType agentType, String model, int contextSize) {
        String baseTemplate = agentType == AgentType.JUDGE
                ? AgentEngineConstants.JUDGE_BASE_PROMPT
                : AgentEngineConstants.WRITER_BASE_PROMPT;
        int promptTokens = tokenCounter.count(baseTemplate) + Math.max(0, contextSize) / 4;
        return costOf(model, promptTokens, expectedCompletionTokens(agentType));
    }

    /**
     * Actual cost once the provider has reported usage.
     */
    public CostBreakdown finalize(String model, int promptTokens, int completionTokens) {
        return costOf(model, Math.max(0, promptTokens), Math.max(0, completionTokens));
    }

    public int expectedCompletionTokens(AgentType agentType) {
        AgentEngineProperties.EstimationConfig estimation = properties.getEstimation();
        return agentType == AgentType.JUDGE
                ? estimation.getJudgeCompletionTokens()
                : estimation.getWriterCompletionTokens();
    }

    public BigDecimal monetaryCost(String model, int promptTokens, int completionTokens) {
        ModelPricing pricing = pricingCatalog.require(model);
        BigDecimal input = BigDecimal.valueOf(promptTokens).multiply(pricing.inputCostPer1k());
        BigDecimal output = BigDecimal.valueOf(completionTokens).multiply(pricing.outputCostPer1k());
        return input.add(output).divide(THOUSAND, 8, RoundingMode.HALF_UP);
    }

    public long toCredits(BigDecimal costUsd) {
        AgentEngineProperties.CreditsConfig credits = properties.getCredits();
        long raw = costUsd.multiply(BigDecimal.valueOf(credits.getCreditsPerDollar()))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
        return Math.max(credits.getMinimumCreditCost(), raw);
    }

    private CostBreakdown costOf(String model, int promptTokens, int completionTokens) {
        BigDecimal costUsd = monetaryCost(model, promptTokens, completionTokens);
        return new CostBreakdown(model, promptTokens, completionTokens, costUsd, toCredits(costUsd));
    }
}
