package com.duelo.engine.parse;

import com.duelo.engine.model.JudgeCandidate;
import com.duelo.engine.model.JudgeVote;

import java.util.List;

/**
 * Extracts ranked entries in one textual shape and hands them to the shared validation.
 */
abstract class RankingStrategy implements ParsingStrategy<List<JudgeCandidate>, List<JudgeVote>> {

    private final RankingValidator validator;

    protected RankingStrategy(RankingValidator validator) {
        this.validator = validator;
    }

    protected abstract List<RankedEntry> extract(String raw);

    @Override
    public ParseOutcome<List<JudgeVote>> attempt(String raw, List<JudgeCandidate> candidates) {
        List<RankedEntry> entries = extract(raw);
        if (entries.isEmpty()) {
            return ParseOutcome.failure(name(), "no ranked entries found");
        }
        return validator.validate(name(), entries, candidates);
    }
}
