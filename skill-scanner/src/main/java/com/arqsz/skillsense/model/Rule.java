package com.arqsz.skillsense.model;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Immutable detection rule of the catalog.
 * <p>
 * {@code fileExtensions} and {@code fileNamePattern} are optional; a rule without
 * either constraint applies to every file.
 */
public record Rule(
        String id,
        Category category,
        Severity severity,
        String title,
        Confidence confidence,
        Pattern pattern,
        List<String> fileExtensions,
        Pattern fileNamePattern) {

    public Rule {
        fileExtensions = fileExtensions == null ? null : List.copyOf(fileExtensions);
    }

    /**
     * Checks if this rule should be evaluated against a file
     * 
     * @param path The file path as supplied
     * @return true if the extension and file name constraints are satisfied
     */
    public boolean isApplicableTo(String path) {
        String lowered = path.toLowerCase(Locale.ROOT);
        if (fileExtensions != null && !fileExtensions.isEmpty()
                && fileExtensions.stream().noneMatch(lowered::endsWith)) {
            return false;
        }
        return fileNamePattern == null || fileNamePattern.matcher(path).find();
    }
}
