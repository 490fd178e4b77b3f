package com.duelo.engine.model;

import com.duelo.engine.cost.CostBreakdown;

import java.util.UUID;

public record WriterResult(UUID executionId, WriterOutput output, CostBreakdown cost, long creditsCharged) {
}
