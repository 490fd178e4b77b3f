package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;

/**
 * Last resort: always yields a draft, even for an empty answer.
 */
class DefaultTitleStrategy implements ParsingStrategy<String, WriterDraft> {

    @Override
    public String name() {
        return AgentEngineConstants.STRATEGY_DEFAULT_TITLE;
    }

    @Override
    public ParseOutcome<WriterDraft> attempt(String raw, String fallbackTitle) {
        String content = WriterText.stripTextMarker(raw);
        if (content.isEmpty()) {
            content = AgentEngineConstants.EMPTY_RESPONSE_CONTENT;
        }
        return ParseOutcome.fallback(name(), new WriterDraft(AgentEngineConstants.DEFAULT_TITLE, content));
    }
}
