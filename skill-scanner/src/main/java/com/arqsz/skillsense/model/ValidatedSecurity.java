package com.arqsz.skillsense.model;

import java.util.List;

/**
 * Validator response: verdicts for submitted findings plus a short summary
 */
public record ValidatedSecurity(List<ValidatedFinding> validatedFindings, String securitySummary) {

    public ValidatedSecurity {
        validatedFindings = List.copyOf(validatedFindings);
    }
}
