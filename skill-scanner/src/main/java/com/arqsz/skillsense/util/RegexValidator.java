package com.arqsz.skillsense.util;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates and compiles detection patterns, rejecting shapes prone to catastrophic backtracking.
 * Scanned artifacts are untrusted input, so a pattern that backtracks exponentially on crafted
 * text must never make it into the catalog.
 */
public final class RegexValidator {

    private static final int MAX_PATTERN_LENGTH = 500;
    private static final int MAX_QUANTIFIER_REPETITIONS = 100;
    private static final int MAX_UNBOUNDED_QUANTIFIERS = 10;

    /**
     * Checks if a regex pattern is valid and safe.
     *
     * @param regex The regex string to check
     * @return true if valid and safe, false otherwise
     */
    public static boolean isValidRegex(String regex) {
        try {
            compileSafe(regex, Pattern.CASE_INSENSITIVE);
            return true;
        } catch (RegexValidationException e) {
            return false;
        }
    }

    /**
     * Validates and compiles a regex pattern
     * 
     * @param regex The regex string to compile
     * @param flags Pattern flags (e.g. Pattern.CASE_INSENSITIVE)
     * @return Compiled pattern
     * @throws RegexValidationException if pattern is rejected
     */
    public static Pattern compileSafe(String regex, int flags) throws RegexValidationException {
        if (regex == null || regex.isEmpty()) {
            throw new RegexValidationException("Pattern cannot be null or empty");
        }

        if (regex.length() > MAX_PATTERN_LENGTH) {
            throw new RegexValidationException("Pattern too long");
        }

        validatePatternSafety(regex);

        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            throw new RegexValidationException("Invalid regex syntax: " + e.getDescription());
        }
    }

    /**
     * Validates pattern safety by checking for ReDoS indicators
     */
    private static void validatePatternSafety(String regex) throws RegexValidationException {
        if (regex.matches(".*\\([^)]*[*+{][^)]*\\)[*+{].*")) {
            throw new RegexValidationException("Nested quantifiers detected - potential ReDoS");
        }

        if (regex.matches(".*\\([^)]*\\|[^)]*\\|[^)]*\\)[*+{].*")) {
            throw new RegexValidationException("Alternation with quantifiers - potential ReDoS");
        }

        if (regex.matches(".*\\{\\d+,\\d+\\}.*")) {
            for (String part : regex.split("\\{|,|\\}")) {
                String trimmed = part.trim();
                if (!trimmed.matches("\\d+")) {
                    continue;
                }
                int num = Integer.parseInt(trimmed);
                if (num > MAX_QUANTIFIER_REPETITIONS) {
                    throw new RegexValidationException(
                            "Quantifier repetition too high (" + num + ", max " + MAX_QUANTIFIER_REPETITIONS + ")");
                }
            }
        }

        long starCount = regex.chars().filter(ch -> ch == '*').count();
        long plusCount = regex.chars().filter(ch -> ch == '+').count();
        if (starCount + plusCount > MAX_UNBOUNDED_QUANTIFIERS) {
            throw new RegexValidationException("Too many quantifiers - potential ReDoS");
        }
    }

    /**
     * Exception thrown when regex validation fails
     */
    public static class RegexValidationException extends Exception {
        public RegexValidationException(String message) {
            super(message);
        }
    }

    private RegexValidator() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
