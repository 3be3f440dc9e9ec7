package com.arqsz.skillsense.model;

/**
 * Ordinal risk level of a finding, lowest first
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Checks if this severity is HIGH or CRITICAL
     * 
     * @return true for high-risk severities
     */
    public boolean isHighRisk() {
        return this == HIGH || this == CRITICAL;
    }
}
