package com.arqsz.skillsense.model;

/**
 * One concrete detection instance, produced by a catalog rule or a manifest check.
 * <p>
 * {@code lineStart} and {@code lineEnd} are 1-indexed and null when the finding
 * has no meaningful line (for example a dependency taken from parsed JSON).
 */
public record Finding(
        String id,
        Category category,
        Severity severity,
        String title,
        String evidence,
        String filePath,
        Integer lineStart,
        Integer lineEnd,
        Confidence confidence) {
}
