package com.arqsz.skillsense.model;

/**
 * Leading excerpt of a file that has at least one finding
 */
public record ContextSnippet(String filePath, String snippet) {
}
