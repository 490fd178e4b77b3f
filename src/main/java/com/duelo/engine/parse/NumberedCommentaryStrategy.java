package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code 1. Title} followed by a {@code Commentary:} line, the format the judge prompt asks for.
 */
class NumberedCommentaryStrategy extends RankingStrategy {

    private static final Pattern ENTRY = Pattern.compile(
            "^\\s*(\\d{1,4})[.)]\\s*([^\\n]+?)\\s*\\n\\s*\\**commentary\\**\\s*:\\s*\\**\\s*(.*?)(?=\\n\\s*\\d+[.)]\\s|\\z)",
            Pattern.MULTILINE | Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    NumberedCommentaryStrategy(RankingValidator validator) {
        super(validator);
    }

    @Override
    public String name() {
        return AgentEngineConstants.STRATEGY_NUMBERED_COMMENTARY;
    }

    @Override
    protected List<RankedEntry> extract(String raw) {
        List<RankedEntry> entries = new ArrayList<>();
        Matcher matcher = ENTRY.matcher(raw);
        while (matcher.find()) {
            entries.add(new RankedEntry(Integer.parseInt(matcher.group(1)),
                    matcher.group(2).trim(),
                    matcher.group(3).trim()));
        }
        return entries;
    }
}
