package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The requested {@code Title: ... / Text: ...} layout.
 */
class TitleTextMarkersStrategy implements ParsingStrategy<String, WriterDraft> {

    private static final Pattern TITLE = Pattern.compile("(?im)^\\s*\\**\\s*title\\s*\\**\\s*:\\s*(.+?)\\s*$");
    private static final Pattern TEXT = Pattern.compile("(?ims)^\\s*\\**\\s*text\\s*\\**\\s*:\\s*(.+)\\z");

    @Override
    public String name() {
        return AgentEngineConstants.STRATEGY_TITLE_TEXT_MARKERS;
    }

    @Override
    public ParseOutcome<WriterDraft> attempt(String raw, String fallbackTitle) {
        Matcher title = TITLE.matcher(raw);
        if (!title.find()) {
            return ParseOutcome.failure(name(), "no Title: marker");
        }
        Matcher text = TEXT.matcher(raw);
        if (!text.find(title.end())) {
            return ParseOutcome.failure(name(), "no Text: marker after the title");
        }
        String cleanTitle = WriterText.cleanTitle(title.group(1));
        if (!WriterText.isValidTitle(cleanTitle)) {
            return ParseOutcome.failure(name(), "title is empty, too long or a marker");
        }
        String content = text.group(1).replaceFirst("^\\*+", "").strip();
        if (!WriterText.isValidContent(content)) {
            return ParseOutcome.failure(name(), "content too short or starts with a marker");
        }
        return ParseOutcome.success(name(), new WriterDraft(cleanTitle, content));
    }
}
