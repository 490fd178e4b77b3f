package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;

import java.util.Arrays;

/**
 * Builds a title from the opening words of the text.
 */
class SynthesizedTitleStrategy implements ParsingStrategy<String, WriterDraft> {

    @Override
    public String name() {
        return AgentEngineConstants.STRATEGY_SYNTHESIZED_TITLE;
    }

    @Override
    public ParseOutcome<WriterDraft> attempt(String raw, String fallbackTitle) {
        String content = WriterText.stripTextMarker(raw);
        if (content.isEmpty()) {
            return ParseOutcome.failure(name(), "empty answer");
        }
        String[] words = content.split("\\s+");
        int count = Math.min(words.length, AgentEngineConstants.SYNTHESIZED_TITLE_WORDS);
        String title = WriterText.cleanTitle(String.join(" ", Arrays.copyOf(words, count)))
                .replaceAll("[.,;:!?]+$", "");
        if (title.isEmpty()) {
            return ParseOutcome.failure(name(), "no usable words");
        }
        if (words.length > count) {
            title = title + "...";
        }
        if (title.length() > AgentEngineConstants.MAX_TITLE_LENGTH) {
            title = title.substring(0, AgentEngineConstants.MAX_TITLE_LENGTH);
        }
        return ParseOutcome.fallback(name(), new WriterDraft(title, content));
    }
}
