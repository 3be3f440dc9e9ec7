package com.arqsz.skillsense.constants;

import java.util.Set;

/**
 * Constants for loading skill artifacts from disk
 */
public final class AcquisitionConstants {

    public static final String PRIMARY_DOCUMENT = "SKILL.md";

    public static final long DEFAULT_MAX_FILE_BYTES = 1_000_000;

    public static final Set<String> ALLOWED_EXTENSIONS = Set.of(
            ".py", ".js", ".ts", ".tsx", ".sh", ".bash", ".yaml", ".yml", ".json",
            ".md", ".txt", ".toml", ".ini", ".cfg", ".dockerfile", ".sql");

    public static final Set<String> EXCLUDED_PATH_PARTS = Set.of(
            "node_modules", "dist", "build", ".git", "__pycache__", ".next",
            ".cache", ".venv", "venv", "target", "coverage");

    public static final Set<String> BINARY_EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".gif", ".webp", ".svg", ".ico", ".pdf",
            ".zip", ".gz", ".tar", ".mp4", ".mp3", ".wav", ".woff", ".woff2",
            ".ttf", ".otf", ".exe", ".dll", ".bin");

    public static final String DOCKERFILE = "dockerfile";

    private AcquisitionConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
