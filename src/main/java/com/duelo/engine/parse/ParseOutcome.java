package com.duelo.engine.parse;

import org.springframework.lang.Nullable;

/**
 * Result of one parsing strategy. {@code SUCCESS} means the model followed the requested format,
 * {@code FALLBACK} means a usable value was recovered from a degraded answer.
 */
public record ParseOutcome<T>(Kind kind, @Nullable T value, String strategy, @Nullable String reason) {

    public enum Kind {
        SUCCESS, FALLBACK, FAILURE
    }

    public static <T> ParseOutcome<T> success(String strategy, T value) {
        return new ParseOutcome<>(Kind.SUCCESS, value, strategy, null);
    }

    public static <T> ParseOutcome<T> fallback(String strategy, T value) {
        return new ParseOutcome<>(Kind.FALLBACK, value, strategy, null);
    }

    public static <T> ParseOutcome<T> failure(String strategy, String reason) {
        return new ParseOutcome<>(Kind.FAILURE, null, strategy, reason);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isUsable() {
        return kind != Kind.FAILURE && value != null;
    }
}
