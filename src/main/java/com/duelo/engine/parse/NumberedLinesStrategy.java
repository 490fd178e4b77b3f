package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numbered title lines; any lines until the next number are the commentary.
 */
class NumberedLinesStrategy extends RankingStrategy {

    private static final Pattern NUMBERED = Pattern.compile("^\\s*(\\d{1,4})[.)]\\s+(.+)$");
    private static final Pattern COMMENTARY_LABEL = Pattern.compile("(?i)^\\**\\s*commentary\\s*\\**\\s*:\\s*\\**\\s*");

    NumberedLinesStrategy(RankingValidator validator) {
        super(validator);
    }

    @Override
    public String name() {
        return AgentEngineConstants.STRATEGY_NUMBERED_LINES;
    }

    @Override
    protected List<RankedEntry> extract(String raw) {
        List<RankedEntry> entries = new ArrayList<>();
        Integer rank = null;
        String title = null;
        StringBuilder commentary = new StringBuilder();
        for (String line : raw.split("\\R")) {
            Matcher numbered = NUMBERED.matcher(line);
            if (numbered.matches()) {
                if (rank != null) {
                    entries.add(new RankedEntry(rank, title, commentary.toString().trim()));
                }
                rank = Integer.parseInt(numbered.group(1));
                title = numbered.group(2).trim();
                commentary.setLength(0);
            } else if (rank != null && !line.isBlank()) {
                if (commentary.length() > 0) {
                    commentary.append(' ');
                }
                commentary.append(COMMENTARY_LABEL.matcher(line.trim()).replaceFirst(""));
            }
        }
        if (rank != null) {
            entries.add(new RankedEntry(rank, title, commentary.toString().trim()));
        }
        return entries;
    }
}
