package com.arqsz.skillsense.model;

/**
 * Raw occurrence of a rule pattern in a file, before it becomes a {@link Finding}
 * 
 * @param window     Untrimmed text surrounding the match
 * @param lineNumber 1-indexed line of the match start, null for an invalid offset
 */
public record RuleMatch(
        Rule rule,
        String filePath,
        int start,
        int end,
        String window,
        Integer lineNumber) {
}
