package com.arqsz.skillsense.model;

import java.util.List;

/**
 * Final record of one artifact analysis, as handed to persistence and API layers
 * 
 * @param securitySummary Validator summary, null when validation did not run
 * @param llmModel        Validator model name, null when validation did not run
 * @param analyzedAt      UTC ISO-8601 timestamp at second precision
 */
public record AnalysisReport(
        List<Finding> findings,
        List<ValidatedFinding> validatedFindings,
        String securitySummary,
        UserExplanation userExplanation,
        int riskScore,
        String trustBadge,
        CapabilityFlags capabilities,
        boolean llmUsed,
        String llmModel,
        String analyzedAt) {
}
