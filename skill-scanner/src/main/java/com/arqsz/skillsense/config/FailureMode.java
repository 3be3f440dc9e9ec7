package com.arqsz.skillsense.config;

/**
 * What an analysis does when the external validator fails
 */
public enum FailureMode {
    /** The whole analysis fails and no result is stored */
    FAIL_UNIT,
    /** The deterministic result is kept with validation marked as not used */
    DEGRADE
}
