package com.duelo.engine.parse;

import com.duelo.engine.model.JudgeCandidate;
import com.duelo.engine.model.JudgeOutput;
import com.duelo.engine.model.JudgeVote;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Turns a judge answer into one vote per submission. Strategies run in order; the first one whose
 * ranking passes validation wins. When none does the output carries no votes and
 * {@code parsingSuccess=false}: partial rankings are never returned.
 */
@Component
@Slf4j
public class JudgeResponseParser {

    private final List<ParsingStrategy<List<JudgeCandidate>, List<JudgeVote>>> strategies;

    public JudgeResponseParser(RankingValidator validator, ObjectMapper objectMapper) {
        this.strategies = List.of(
                new NumberedCommentaryStrategy(validator),
                new NumberedLinesStrategy(validator),
                new JsonRankingStrategy(validator, objectMapper));
    }

    public JudgeOutput parse(@Nullable String raw, List<JudgeCandidate> candidates) {
        String text = raw != null ? raw : "";
        if (!StringUtils.hasText(text) || candidates.isEmpty()) {
            log.warn("Judge answer is empty or there is nothing to rank.");
            return JudgeOutput.unparsed(text);
        }
        for (ParsingStrategy<List<JudgeCandidate>, List<JudgeVote>> strategy : strategies) {
            ParseOutcome<List<JudgeVote>> outcome;
            try {
                outcome = strategy.attempt(text, candidates);
            } catch (RuntimeException ex) {
                log.warn("Judge strategy {} failed on the answer: {}", strategy.name(), ex.toString());
                continue;
            }
            if (outcome.isSuccess()) {
                return new JudgeOutput(outcome.value(), text, true, outcome.strategy());
            }
            log.debug("Judge strategy {} rejected the answer: {}", strategy.name(), outcome.reason());
        }
        log.warn("Judge answer could not be mapped to the {} submissions; no votes recorded.", candidates.size());
        return JudgeOutput.unparsed(text);
    }
}
