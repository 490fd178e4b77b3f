package com.duelo.engine.model;

import org.springframework.lang.Nullable;

import java.util.UUID;

/**
 * What a writer agent is asked to produce.
 *
 * @param requestId          the generation request this run belongs to, recorded as the execution target
 * @param contestDescription theme and rules of the contest the text is written for
 * @param titleHint          title the user asked for; also the fallback title when the model omits one
 * @param guidance           elements the user wants in the text
 */
public record WriterContext(
        @Nullable UUID requestId,
        @Nullable String contestDescription,
        @Nullable String titleHint,
        @Nullable String guidance
) {
}
