package com.arqsz.skillsense.model;

import java.util.List;

/**
 * Verdict of the external validator on one existing finding
 */
public record ValidatedFinding(
        String findingId,
        boolean isTruePositive,
        Severity finalSeverity,
        String reason,
        List<String> mitigation) {

    public ValidatedFinding {
        mitigation = mitigation == null ? List.of() : List.copyOf(mitigation);
    }
}
