package org.kifexport.parser;

import java.util.Locale;

import com.google.common.base.CharMatcher;

/**
 * Turns character offsets into human readable positions for error messages.
 */
public final class SourceLocation {
    private static final int SNIPPET_LENGTH = 60;

    private SourceLocation() {
        // Uncallable utility constructor
    }

    /**
     * Describe an offset as line and column, both 1-based.
     */
    public static String describe(String text, int offset) {
        int line = 1;
        int lineStart = 0;
        int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return String.format(Locale.ROOT, "line %d, column %d (offset %d)", line, offset - lineStart + 1, offset);
    }

    /**
     * A single line excerpt of {@code text[start, end)} short enough for a
     * log line.
     */
    public static String snippet(String text, int start, int end) {
        String excerpt = CharMatcher.whitespace().trimAndCollapseFrom(text.substring(start, end), ' ');
        if (excerpt.length() <= SNIPPET_LENGTH) {
            return excerpt;
        }
        return excerpt.substring(0, SNIPPET_LENGTH - 3) + "...";
    }
}
