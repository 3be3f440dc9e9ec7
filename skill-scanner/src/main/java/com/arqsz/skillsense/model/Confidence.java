package com.arqsz.skillsense.model;

/**
 * Scanner certainty in a finding, independent of its severity
 */
public enum Confidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    Confidence(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
