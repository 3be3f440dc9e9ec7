package com.arqsz.skillsense.model;

/**
 * Model and reasoning effort used for one validation call
 * 
 * @param reasoningEffort Effort hint for the model, null when none is requested
 */
public record ValidatorProfile(Tier tier, String model, String reasoningEffort) {

    public enum Tier {
        DEFAULT,
        ESCALATED
    }
}
