package com.duelo.engine.parse;

import com.duelo.engine.model.WriterOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Extracts a title and text from a writer answer. Strategies run in order and the first usable
 * outcome wins; the last one always applies, so parsing never fails outright.
 */
@Component
@Slf4j
public class WriterResponseParser {

    private final List<ParsingStrategy<String, WriterDraft>> strategies = List.of(
            new TitleTextMarkersStrategy(),
            new FirstLineTitleStrategy(),
            new CallerTitleStrategy(),
            new SynthesizedTitleStrategy(),
            new DefaultTitleStrategy());

    public WriterOutput parse(@Nullable String raw, @Nullable String fallbackTitle) {
        String text = raw != null ? raw : "";
        for (ParsingStrategy<String, WriterDraft> strategy : strategies) {
            ParseOutcome<WriterDraft> outcome = strategy.attempt(text, fallbackTitle);
            if (outcome.isUsable()) {
                WriterDraft draft = outcome.value();
                if (!outcome.isSuccess()) {
                    log.info("Writer answer parsed by fallback strategy {}.", outcome.strategy());
                }
                return new WriterOutput(draft.title(), draft.content(), text, outcome.isSuccess(), outcome.strategy());
            }
            log.debug("Writer strategy {} rejected the answer: {}", strategy.name(), outcome.reason());
        }
        throw new IllegalStateException("default writer strategy must always apply");
    }
}
