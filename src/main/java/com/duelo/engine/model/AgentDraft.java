package com.duelo.engine.model;

import com.duelo.entity.AgentType;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * Editable fields of an agent.
 */
public record AgentDraft(
        String name,
        @Nullable String description,
        AgentType type,
        String personalityPrompt,
        String defaultModel,
        boolean publicAgent
) {

    public AgentDraft {
        Objects.requireNonNull(type, "type is required");
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("name is required");
        }
        if (!StringUtils.hasText(personalityPrompt)) {
            throw new IllegalArgumentException("personalityPrompt is required");
        }
        if (!StringUtils.hasText(defaultModel)) {
            throw new IllegalArgumentException("defaultModel is required");
        }
    }
}
