package com.arqsz.skillsense.validation;

import java.util.List;

import com.arqsz.skillsense.constants.ValidationConstants;
import com.arqsz.skillsense.model.Confidence;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.Severity;
import com.arqsz.skillsense.model.ValidatorProfile;
import com.arqsz.skillsense.model.ValidatorProfile.Tier;

/**
 * Decides when deterministic findings need a second opinion, and which validator profile gives it.
 * Both decisions depend only on their arguments.
 */
public class EscalationPolicy {

    private final String defaultModel;
    private final String escalatedModel;
    private final String escalatedEffort;

    public EscalationPolicy() {
        this(ValidationConstants.DEFAULT_MODEL,
                ValidationConstants.ESCALATED_MODEL,
                ValidationConstants.ESCALATED_REASONING_EFFORT);
    }

    public EscalationPolicy(String defaultModel, String escalatedModel, String escalatedEffort) {
        this.defaultModel = defaultModel;
        this.escalatedModel = escalatedModel;
        this.escalatedEffort = escalatedEffort;
    }

    /**
     * True iff there is a CRITICAL finding, at least two HIGH findings, or the
     * risk score reaches the escalation threshold
     * 
     * @param findings  The findings of the scan
     * @param riskScore The scan risk score
     * @return true if validation should run
     */
    public boolean shouldEscalate(List<Finding> findings, int riskScore) {
        long criticalCount = findings.stream().filter(f -> f.severity() == Severity.CRITICAL).count();
        long highCount = findings.stream().filter(f -> f.severity() == Severity.HIGH).count();
        return criticalCount > 0
                || highCount >= ValidationConstants.ESCALATION_MIN_HIGH_FINDINGS
                || riskScore >= ValidationConstants.ESCALATION_MIN_RISK_SCORE;
    }

    /**
     * Picks the higher-capability profile, with reduced effort, when a CRITICAL finding
     * is not high-confidence; the default profile otherwise
     * 
     * @param findings The findings to validate
     * @return The validator profile
     */
    public ValidatorProfile selectValidatorProfile(List<Finding> findings) {
        boolean uncertainCritical = findings.stream()
                .anyMatch(f -> f.severity() == Severity.CRITICAL && f.confidence() != Confidence.HIGH);
        if (uncertainCritical) {
            return new ValidatorProfile(Tier.ESCALATED, escalatedModel, escalatedEffort);
        }
        return new ValidatorProfile(Tier.DEFAULT, defaultModel, null);
    }
}
