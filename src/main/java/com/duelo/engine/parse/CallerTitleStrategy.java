package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;
import org.springframework.util.StringUtils;

class CallerTitleStrategy implements ParsingStrategy<String, WriterDraft> {

    @Override
    public String name() {
        return AgentEngineConstants.STRATEGY_CALLER_TITLE;
    }

    @Override
    public ParseOutcome<WriterDraft> attempt(String raw, String fallbackTitle) {
        if (!StringUtils.hasText(fallbackTitle)) {
            return ParseOutcome.failure(name(), "no caller title");
        }
        String content = WriterText.stripTextMarker(raw);
        if (content.isEmpty()) {
            return ParseOutcome.failure(name(), "empty answer");
        }
        return ParseOutcome.fallback(name(), new WriterDraft(fallbackTitle.trim(), content));
    }
}
