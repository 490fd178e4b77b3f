package com.duelo.engine.parse;

/**
 * One way of reading structure out of raw model text.
 *
 * @param <C> what the strategy needs besides the text
 * @param <T> the structured value it produces
 */
public interface ParsingStrategy<C, T> {

    String name();

    ParseOutcome<T> attempt(String raw, C context);
}
