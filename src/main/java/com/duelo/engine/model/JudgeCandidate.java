package com.duelo.engine.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A contest submission as the judge sees it: no author information.
 */
public record JudgeCandidate(UUID submissionId, String title, String content) {

    public JudgeCandidate {
        Objects.requireNonNull(submissionId, "submissionId is required");
        title = title != null ? title : "";
        content = content != null ? content : "";
    }
}
