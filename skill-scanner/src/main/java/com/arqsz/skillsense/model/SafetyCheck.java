package com.arqsz.skillsense.model;

/**
 * User-facing safe/risk message pair for one capability
 */
public record SafetyCheck(String key, boolean safe, String safeMessage, String riskMessage) {

    public String statement() {
        return safe ? safeMessage : riskMessage;
    }
}
