package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;
import org.springframework.lang.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleanup rules shared by the writer strategies.
 */
final class WriterText {

    private static final Pattern LEADING_TEXT_MARKER = Pattern.compile("(?is)^\\s*\\**\\s*(?:text|content)\\s*\\**\\s*:\\s*");
    private static final Pattern TITLE_DECORATION = Pattern.compile("^[\\s*#_\"'“”‘’]+|[\\s*#_\"'“”‘’]+$");
    private static final Pattern TITLE_PREFIX = Pattern.compile("(?i)^\\s*title\\s*:\\s*");

    private WriterText() {
    }

    static String cleanTitle(@Nullable String candidate) {
        if (candidate == null) {
            return "";
        }
        String title = TITLE_DECORATION.matcher(candidate).replaceAll("");
        title = TITLE_PREFIX.matcher(title).replaceFirst("");
        title = TITLE_DECORATION.matcher(title).replaceAll("");
        return title.replaceAll("\\s+", " ").trim();
    }

    static String stripTextMarker(String content) {
        return LEADING_TEXT_MARKER.matcher(content).replaceFirst("").strip();
    }

    static boolean isValidTitle(String title) {
        if (title.isEmpty() || title.length() > AgentEngineConstants.MAX_TITLE_LENGTH) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        return !lower.startsWith("text:") && !lower.startsWith("content:");
    }

    static boolean isValidContent(String content) {
        return content.length() >= AgentEngineConstants.MIN_CONTENT_LENGTH
                && !content.toLowerCase(Locale.ROOT).startsWith("title:");
    }
}
