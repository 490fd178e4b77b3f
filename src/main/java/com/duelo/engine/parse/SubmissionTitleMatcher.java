package com.duelo.engine.parse;

import com.duelo.engine.model.JudgeCandidate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps a title written by the judge model back to a submission.
 * <p>
 * Titles are normalised first. An exact match wins; otherwise a single candidate whose title
 * contains, or is contained in, the parsed title; otherwise a single candidate within edit distance
 * {@code max(2, length / 10)}. When a stage finds several candidates the title is ambiguous and
 * no match is returned.
 */
@Component
public class SubmissionTitleMatcher {

    private static final Pattern DECORATION = Pattern.compile("[\"'“”‘’*_`\\[\\]()<>#]");
    private static final Pattern LABEL = Pattern.compile("^(?:text|title)\\s*(?:\\d+\\s*)?:\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_CONTAINMENT_LENGTH = 3;

    public Optional<JudgeCandidate> match(@Nullable String parsedTitle, List<JudgeCandidate> candidates) {
        String wanted = normalize(parsedTitle);
        if (wanted.isEmpty() || candidates.isEmpty()) {
            return Optional.empty();
        }

        List<JudgeCandidate> exact = new ArrayList<>();
        for (JudgeCandidate candidate : candidates) {
            if (normalize(candidate.title()).equals(wanted)) {
                exact.add(candidate);
            }
        }
        if (!exact.isEmpty()) {
            return unique(exact);
        }

        if (wanted.length() >= MIN_CONTAINMENT_LENGTH) {
            List<JudgeCandidate> containing = new ArrayList<>();
            for (JudgeCandidate candidate : candidates) {
                String title = normalize(candidate.title());
                if (title.length() >= MIN_CONTAINMENT_LENGTH && (title.contains(wanted) || wanted.contains(title))) {
                    containing.add(candidate);
                }
            }
            if (!containing.isEmpty()) {
                return unique(containing);
            }
        }

        List<JudgeCandidate> close = new ArrayList<>();
        int best = Integer.MAX_VALUE;
        for (JudgeCandidate candidate : candidates) {
            String title = normalize(candidate.title());
            int threshold = Math.max(2, title.length() / 10);
            int distance = editDistance(wanted, title);
            if (distance > threshold) {
                continue;
            }
            if (distance < best) {
                best = distance;
                close.clear();
            }
            if (distance == best) {
                close.add(candidate);
            }
        }
        return unique(close);
    }

    static String normalize(@Nullable String title) {
        if (title == null) {
            return "";
        }
        String value = title.toLowerCase(Locale.ROOT).trim();
        value = DECORATION.matcher(value).replaceAll(" ");
        value = WHITESPACE.matcher(value).replaceAll(" ").trim();
        value = LABEL.matcher(value).replaceFirst("");
        return value.replaceAll("[\\s.,;:!?-]+$", "").trim();
    }

    static int editDistance(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    private static Optional<JudgeCandidate> unique(List<JudgeCandidate> matches) {
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }
}
