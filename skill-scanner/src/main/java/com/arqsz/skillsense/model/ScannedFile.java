package com.arqsz.skillsense.model;

import java.util.Objects;

/**
 * One decoded text file of a skill artifact
 */
public record ScannedFile(String path, String text) {

    public ScannedFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(text, "text");
    }
}
