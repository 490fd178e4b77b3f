package com.duelo.engine.model;

import com.duelo.engine.cost.CostBreakdown;

import java.util.UUID;

public record JudgeResult(UUID executionId, JudgeOutput output, CostBreakdown cost, long creditsCharged) {
}
