package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;
import com.duelo.engine.model.JudgeCandidate;
import com.duelo.engine.model.JudgeVote;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Accepts a ranking only when it covers every submission exactly once with ranks {@code 1..N}.
 */
@Component
@RequiredArgsConstructor
public class RankingValidator {

    private final SubmissionTitleMatcher titleMatcher;

    public ParseOutcome<List<JudgeVote>> validate(String strategy, List<RankedEntry> entries, List<JudgeCandidate> candidates) {
        int size = candidates.size();
        if (entries.size() != size) {
            return ParseOutcome.failure(strategy, "expected " + size + " ranked texts, found " + entries.size());
        }
        Set<UUID> seenSubmissions = new HashSet<>();
        Set<Integer> seenRanks = new HashSet<>();
        List<JudgeVote> votes = new ArrayList<>();
        for (RankedEntry entry : entries) {
            if (entry.rank() < 1 || entry.rank() > size || !seenRanks.add(entry.rank())) {
                return ParseOutcome.failure(strategy, "rank " + entry.rank() + " is out of range or repeated");
            }
            Optional<JudgeCandidate> match = titleMatcher.match(entry.title(), candidates);
            if (match.isEmpty()) {
                return ParseOutcome.failure(strategy, "title '" + entry.title() + "' matches no single submission");
            }
            UUID submissionId = match.get().submissionId();
            if (!seenSubmissions.add(submissionId)) {
                return ParseOutcome.failure(strategy, "submission ranked twice via '" + entry.title() + "'");
            }
            Integer place = entry.rank() <= AgentEngineConstants.PLACED_RANKS ? entry.rank() : null;
            votes.add(new JudgeVote(submissionId, entry.rank(), place, entry.commentary()));
        }
        votes.sort(Comparator.comparingInt(JudgeVote::rank));
        return ParseOutcome.success(strategy, List.copyOf(votes));
    }
}
