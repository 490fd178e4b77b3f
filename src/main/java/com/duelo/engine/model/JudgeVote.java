package com.duelo.engine.model;

import org.springframework.lang.Nullable;

import java.util.UUID;

/**
 * @param place 1, 2 or 3 for the podium, {@code null} for every lower rank
 */
public record JudgeVote(UUID submissionId, int rank, @Nullable Integer place, String comment) {
}
