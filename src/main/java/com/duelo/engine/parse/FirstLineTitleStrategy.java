package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;

/**
 * Treats a short first line that does not read like a sentence as the title.
 */
class FirstLineTitleStrategy implements ParsingStrategy<String, WriterDraft> {

    @Override
    public String name() {
        return AgentEngineConstants.STRATEGY_FIRST_LINE_TITLE;
    }

    @Override
    public ParseOutcome<WriterDraft> attempt(String raw, String fallbackTitle) {
        String trimmed = raw.strip();
        int newline = trimmed.indexOf('\n');
        if (newline < 0) {
            return ParseOutcome.failure(name(), "single line answer");
        }
        String title = WriterText.cleanTitle(trimmed.substring(0, newline));
        if (title.isEmpty() || title.length() > AgentEngineConstants.MAX_FIRST_LINE_TITLE_LENGTH || title.endsWith(".")) {
            return ParseOutcome.failure(name(), "first line does not look like a title");
        }
        if (!WriterText.isValidTitle(title)) {
            return ParseOutcome.failure(name(), "first line is a marker");
        }
        String content = WriterText.stripTextMarker(trimmed.substring(newline + 1));
        if (content.isEmpty()) {
            return ParseOutcome.failure(name(), "nothing after the first line");
        }
        return ParseOutcome.fallback(name(), new WriterDraft(title, content));
    }
}
