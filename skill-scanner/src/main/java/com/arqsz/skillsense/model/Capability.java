package com.arqsz.skillsense.model;

/**
 * Coarse behavioral tags inferred from artifact text
 */
public enum Capability {
    NETWORK("network"),
    FILE_WRITE("file_write"),
    FILE_DELETE("file_delete"),
    SHELL_EXEC("shell_exec"),
    READS_ENV("reads_env"),
    DB_ACCESS("db_access");

    private final String key;

    Capability(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
