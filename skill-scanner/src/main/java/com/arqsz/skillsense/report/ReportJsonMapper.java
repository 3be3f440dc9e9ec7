package com.arqsz.skillsense.report;

import java.util.List;
import java.util.Map;

import com.arqsz.skillsense.model.AnalysisReport;
import com.arqsz.skillsense.model.CapabilityFlags;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.Rule;
import com.arqsz.skillsense.model.SafetyCheck;
import com.arqsz.skillsense.model.UserExplanation;
import com.arqsz.skillsense.model.ValidatedFinding;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Utility for converting analysis records to their JSON wire format.
 * Field names are consumed by persistence and the UI and must not change.
 */
public final class ReportJsonMapper {

    /**
     * Converts an analysis report to JSON
     * 
     * @param report The report to convert
     * @return JsonObject with every top-level field, nulls included
     */
    public static JsonObject toJson(AnalysisReport report) {
        JsonObject json = new JsonObject();

        JsonArray findings = new JsonArray();
        report.findings().forEach(finding -> findings.add(findingToJson(finding)));
        json.add("findings", findings);

        JsonArray validated = new JsonArray();
        report.validatedFindings().forEach(verdict -> validated.add(validatedFindingToJson(verdict)));
        json.add("validated_findings", validated);

        json.addProperty("security_summary", report.securitySummary());
        json.add("user_explanation", explanationToJson(report.userExplanation()));
        json.addProperty("risk_score", report.riskScore());
        json.addProperty("trust_badge", report.trustBadge());
        json.add("capabilities", capabilitiesToJson(report.capabilities()));
        json.addProperty("llm_used", report.llmUsed());
        json.addProperty("llm_model", report.llmModel());
        json.addProperty("analyzed_at", report.analyzedAt());

        return json;
    }

    public static JsonObject findingToJson(Finding finding) {
        JsonObject json = new JsonObject();
        json.addProperty("id", finding.id());
        json.addProperty("category", finding.category().wireName());
        json.addProperty("severity", finding.severity().name());
        json.addProperty("title", finding.title());
        json.addProperty("evidence", finding.evidence());
        json.addProperty("file_path", finding.filePath());
        json.addProperty("line_start", finding.lineStart());
        json.addProperty("line_end", finding.lineEnd());
        json.addProperty("confidence", finding.confidence().wireName());
        return json;
    }

    public static JsonObject validatedFindingToJson(ValidatedFinding verdict) {
        JsonObject json = new JsonObject();
        json.addProperty("finding_id", verdict.findingId());
        json.addProperty("is_true_positive", verdict.isTruePositive());
        json.addProperty("final_severity", verdict.finalSeverity().name());
        json.addProperty("reason", verdict.reason());
        json.add("mitigation", strings(verdict.mitigation()));
        return json;
    }

    public static JsonObject capabilitiesToJson(CapabilityFlags capabilities) {
        JsonObject json = new JsonObject();
        for (Map.Entry<String, Boolean> entry : capabilities.asMap().entrySet()) {
            json.addProperty(entry.getKey(), entry.getValue());
        }
        return json;
    }

    /**
     * Converts a catalog rule to JSON, for rule listings
     * 
     * @param rule The rule
     * @return JsonObject describing the rule
     */
    public static JsonObject ruleToJson(Rule rule) {
        JsonObject json = new JsonObject();
        json.addProperty("id", rule.id());
        json.addProperty("category", rule.category().wireName());
        json.addProperty("severity", rule.severity().name());
        json.addProperty("title", rule.title());
        json.addProperty("confidence", rule.confidence().wireName());
        json.add("file_extensions", rule.fileExtensions() == null ? null : strings(rule.fileExtensions()));
        json.addProperty("file_name_pattern", rule.fileNamePattern() == null ? null : rule.fileNamePattern().pattern());
        return json;
    }

    private static JsonObject explanationToJson(UserExplanation explanation) {
        JsonObject json = new JsonObject();
        json.addProperty("headline", explanation.headline());
        json.addProperty("summary", explanation.summary());
        json.add("top_concerns", strings(explanation.topConcerns()));
        json.add("recommended_actions", strings(explanation.recommendedActions()));

        JsonArray checks = new JsonArray();
        for (SafetyCheck check : explanation.safetyChecks()) {
            JsonObject checkJson = new JsonObject();
            checkJson.addProperty("key", check.key());
            checkJson.addProperty("safe", check.safe());
            checkJson.addProperty("safe_message", check.safeMessage());
            checkJson.addProperty("risk_message", check.riskMessage());
            checks.add(checkJson);
        }
        json.add("safety_checks", checks);
        json.add("safety_statements", strings(explanation.safetyStatements()));
        return json;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    /**
     * Private constructor to prevent instantiation of utility class.
     */
    private ReportJsonMapper() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
