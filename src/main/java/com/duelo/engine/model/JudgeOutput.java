package com.duelo.engine.model;

import org.springframework.lang.Nullable;

import java.util.List;

public record JudgeOutput(List<JudgeVote> votes, String rawResponse, boolean parsingSuccess, @Nullable String strategy) {

    public JudgeOutput {
        votes = votes != null ? List.copyOf(votes) : List.of();
    }

    public static JudgeOutput unparsed(String rawResponse) {
        return new JudgeOutput(List.of(), rawResponse, false, null);
    }
}
