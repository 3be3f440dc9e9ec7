package com.arqsz.skillsense.model;

/**
 * Detection rule category
 */
public enum Category {
    EXEC("exec"),
    FILESYSTEM("filesystem"),
    NETWORK("network"),
    SECRETS("secrets"),
    DEPS("deps"),
    PROMPT_INJECTION("prompt_injection");

    private final String wireName;

    Category(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
