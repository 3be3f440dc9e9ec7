package com.arqsz.skillsense.report;

import java.util.ArrayList;
import java.util.List;

import com.arqsz.skillsense.constants.ReportConstants;
import com.arqsz.skillsense.model.AnalysisReport;
import com.arqsz.skillsense.model.Capability;
import com.arqsz.skillsense.model.CapabilityFlags;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.SafetyCheck;
import com.arqsz.skillsense.model.ScanResult;
import com.arqsz.skillsense.model.ValidatedFinding;
import com.arqsz.skillsense.model.ValidatedSecurity;
import com.arqsz.skillsense.model.UserExplanation;

/**
 * Builds the final analysis record, including the user-facing explanation
 */
public class ResultAssembler {

    /**
     * Assembles the final record
     * 
     * @param scan       The deterministic scan result
     * @param validation Validator output, or null when validation did not run
     * @param llmModel   Validator model, or null when validation did not run
     * @param analyzedAt UTC ISO-8601 timestamp
     * @return The analysis report
     */
    public AnalysisReport assemble(ScanResult scan, ValidatedSecurity validation, String llmModel, String analyzedAt) {
        List<ValidatedFinding> validated = validation == null ? List.of() : validation.validatedFindings();
        String securitySummary = validation == null ? null : validation.securitySummary();

        List<SafetyCheck> checks = safetyChecks(scan.capabilities());
        List<String> statements = new ArrayList<>();
        for (SafetyCheck check : checks) {
            statements.add(check.statement());
        }

        UserExplanation explanation = new UserExplanation(
                scan.trustBadge(),
                summary(scan.findings(), securitySummary),
                topConcerns(scan.findings()),
                recommendedActions(validated),
                checks,
                statements);

        return new AnalysisReport(
                scan.findings(),
                validated,
                securitySummary,
                explanation,
                scan.riskScore(),
                scan.trustBadge(),
                scan.capabilities(),
                validation != null,
                llmModel,
                analyzedAt);
    }

    /**
     * Validator summary when present, else a fixed message chosen by the findings
     */
    String summary(List<Finding> findings, String securitySummary) {
        if (securitySummary != null && !securitySummary.isEmpty()) {
            return securitySummary;
        }
        if (findings.isEmpty()) {
            return ReportConstants.SUMMARY_NO_FINDINGS;
        }
        long highRisk = findings.stream().filter(f -> f.severity().isHighRisk()).count();
        if (highRisk == 0) {
            return ReportConstants.SUMMARY_LOW_MEDIUM_ONLY;
        }
        return String.format(ReportConstants.SUMMARY_HIGH_RISK_FORMAT, highRisk);
    }

    /**
     * Titles of the first HIGH/CRITICAL findings, or of the first findings of any severity
     */
    List<String> topConcerns(List<Finding> findings) {
        List<String> concerns = findings.stream()
                .filter(f -> f.severity().isHighRisk())
                .limit(ReportConstants.TOP_CONCERNS_MAX)
                .map(Finding::title)
                .toList();
        if (!concerns.isEmpty()) {
            return concerns;
        }
        return findings.stream()
                .limit(ReportConstants.TOP_CONCERNS_MAX)
                .map(Finding::title)
                .toList();
    }

    /**
     * Mitigations of the first validated findings, or generic advice when there are none
     */
    List<String> recommendedActions(List<ValidatedFinding> validated) {
        List<String> actions = new ArrayList<>();
        for (ValidatedFinding verdict : validated.subList(
                0, Math.min(ReportConstants.VALIDATED_FINDINGS_FOR_ACTIONS, validated.size()))) {
            for (String bullet : verdict.mitigation()) {
                if (bullet != null && !bullet.isBlank()) {
                    actions.add(bullet.strip());
                }
            }
        }
        if (actions.isEmpty()) {
            return ReportConstants.DEFAULT_RECOMMENDED_ACTIONS;
        }
        return List.copyOf(actions.subList(0, Math.min(ReportConstants.RECOMMENDED_ACTIONS_MAX, actions.size())));
    }

    List<SafetyCheck> safetyChecks(CapabilityFlags capabilities) {
        return List.of(
                check(capabilities, Capability.SHELL_EXEC,
                        ReportConstants.SAFE_SHELL_EXEC, ReportConstants.RISK_SHELL_EXEC),
                check(capabilities, Capability.DB_ACCESS,
                        ReportConstants.SAFE_DB_ACCESS, ReportConstants.RISK_DB_ACCESS),
                check(capabilities, Capability.FILE_DELETE,
                        ReportConstants.SAFE_FILE_DELETE, ReportConstants.RISK_FILE_DELETE),
                check(capabilities, Capability.NETWORK,
                        ReportConstants.SAFE_NETWORK, ReportConstants.RISK_NETWORK),
                check(capabilities, Capability.READS_ENV,
                        ReportConstants.SAFE_READS_ENV, ReportConstants.RISK_READS_ENV));
    }

    private static SafetyCheck check(
            CapabilityFlags capabilities,
            Capability capability,
            String safeMessage,
            String riskMessage) {
        return new SafetyCheck(capability.key(), !capabilities.has(capability), safeMessage, riskMessage);
    }
}
