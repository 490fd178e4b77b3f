package com.duelo.engine.model;

import org.springframework.lang.Nullable;

import java.util.Objects;
import java.util.UUID;

public record JudgeContest(UUID contestId, @Nullable String description) {

    public JudgeContest {
        Objects.requireNonNull(contestId, "contestId is required");
    }
}
