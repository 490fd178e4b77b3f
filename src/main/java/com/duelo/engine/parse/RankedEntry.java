package com.duelo.engine.parse;

/**
 * One line of a judge ranking before its title has been mapped to a submission.
 */
public record RankedEntry(int rank, String title, String commentary) {
}
