package com.arqsz.skillsense.util;

import java.util.regex.Pattern;

/**
 * Text helpers shared by the scanner and the validation request builder
 */
public final class TextUtils {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Collapses every whitespace run to a single space and trims both ends
     * 
     * @param text The text to normalize
     * @return Single-line text
     */
    public static String collapseWhitespace(String text) {
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Truncates to at most {@code maxCodePoints} code points, never splitting a surrogate pair
     * 
     * @param text          The text to truncate
     * @param maxCodePoints Maximum length in code points
     * @return The text, or its leading part
     */
    public static String truncate(String text, int maxCodePoints) {
        if (text.length() <= maxCodePoints) {
            return text;
        }
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    /**
     * Computes the 1-indexed line number of a character offset
     * 
     * @param text   The full text
     * @param offset Offset of the character
     * @return Line number, or null if the offset lies outside the text
     */
    public static Integer lineNumber(String text, int offset) {
        if (offset < 0 || offset > text.length()) {
            return null;
        }
        int newlines = 0;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                newlines++;
            }
        }
        return newlines + 1;
    }

    private TextUtils() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
