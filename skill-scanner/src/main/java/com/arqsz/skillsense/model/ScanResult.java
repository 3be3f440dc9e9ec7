package com.arqsz.skillsense.model;

import java.util.List;

/**
 * Deterministic outcome of scanning one artifact
 */
public record ScanResult(
        List<Finding> findings,
        int riskScore,
        String trustBadge,
        CapabilityFlags capabilities) {

    public ScanResult {
        findings = List.copyOf(findings);
    }
}
