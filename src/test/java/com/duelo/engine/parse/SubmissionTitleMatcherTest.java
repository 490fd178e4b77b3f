package com.duelo.engine.parse;

import com.duelo.engine.model.JudgeCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionTitleMatcherTest {

    private final SubmissionTitleMatcher matcher = new SubmissionTitleMatcher();

    private final JudgeCandidate lowTide = candidate("Low Tide");
    private final JudgeCandidate lighthouse = candidate("The Lighthouse Keeper");
    private final JudgeCandidate storm = candidate("Storm");
    private final List<JudgeCandidate> candidates = List.of(lowTide, lighthouse, storm);

    @Test
    void testExactMatchIgnoresCaseAndDecoration() {
        assertEquals(Optional.of(lowTide), matcher.match("**\"low tide\"**", candidates));
        assertEquals(Optional.of(storm), matcher.match("[Storm]", candidates));
        assertEquals(Optional.of(lighthouse), matcher.match("Text: The Lighthouse Keeper", candidates));
    }

    @Test
    void testContainmentMatch() {
        assertEquals(Optional.of(lighthouse), matcher.match("Lighthouse Keeper", candidates));
        assertEquals(Optional.of(storm), matcher.match("Storm - a vivid, tense piece", candidates));
    }

    @Test
    void testEditDistanceMatch() {
        assertEquals(Optional.of(lowTide), matcher.match("Low Tyde", candidates));
        assertEquals(Optional.of(lighthouse), matcher.match("The Lighthose Keeper", candidates));
    }

    @Test
    void testNoMatch() {
        assertTrue(matcher.match("Something Else Entirely", candidates).isEmpty());
        assertTrue(matcher.match("", candidates).isEmpty());
        assertTrue(matcher.match(null, candidates).isEmpty());
    }

    @Test
    void testAmbiguousContainmentIsRejected() {
        List<JudgeCandidate> similar = List.of(candidate("The Sea"), candidate("The Sea Returns"));

        assertTrue(matcher.match("Sea", similar).isEmpty());
        assertEquals(Optional.of(similar.get(0)), matcher.match("The Sea", similar));
    }

    @Test
    void testAmbiguousEditDistanceIsRejected() {
        List<JudgeCandidate> similar = List.of(candidate("Cat"), candidate("Bat"));

        assertTrue(matcher.match("Hat", similar).isEmpty());
    }

    @Test
    void testEditDistance() {
        assertEquals(0, SubmissionTitleMatcher.editDistance("tide", "tide"));
        assertEquals(1, SubmissionTitleMatcher.editDistance("tide", "tyde"));
        assertEquals(3, SubmissionTitleMatcher.editDistance("kitten", "sitting"));
        assertEquals(4, SubmissionTitleMatcher.editDistance("", "abcd"));
    }

    private static JudgeCandidate candidate(String title) {
        return new JudgeCandidate(UUID.randomUUID(), title, "content of " + title);
    }
}
