package com.arqsz.skillsense.validation;

import java.util.Map;

import com.arqsz.skillsense.constants.ValidationConstants;
import com.arqsz.skillsense.model.ContextSnippet;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.Severity;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * JSON shapes of the validator contract: the task payload and the strict response schema
 */
public final class ValidationJsonMapper {

    /**
     * Converts a request into the task payload sent to the validator
     * 
     * @param request The validation request
     * @return JsonObject with task, risk_score, severity_counts, findings, context_snippets and constraints
     */
    public static JsonObject toTaskPayload(ValidationRequest request) {
        JsonObject json = new JsonObject();
        json.addProperty("task", ValidationConstants.TASK);
        json.addProperty("risk_score", request.riskScore());

        JsonObject counts = new JsonObject();
        for (Map.Entry<Severity, Integer> entry : request.severityCounts().entrySet()) {
            counts.addProperty(entry.getKey().name(), entry.getValue());
        }
        json.add("severity_counts", counts);

        JsonArray findings = new JsonArray();
        request.findings().forEach(finding -> findings.add(findingToJson(finding)));
        json.add("findings", findings);

        JsonArray snippets = new JsonArray();
        for (ContextSnippet snippet : request.contextSnippets()) {
            JsonObject snippetJson = new JsonObject();
            snippetJson.addProperty("file_path", snippet.filePath());
            snippetJson.addProperty("snippet", snippet.snippet());
            snippets.add(snippetJson);
        }
        json.add("context_snippets", snippets);

        JsonObject constraints = new JsonObject();
        constraints.addProperty("reason_max_sentences", ValidationConstants.REASON_MAX_SENTENCES);
        constraints.addProperty("mitigation_max_items", ValidationConstants.MITIGATION_MAX_ITEMS);
        constraints.addProperty("security_summary_max_words", ValidationConstants.SECURITY_SUMMARY_MAX_WORDS);
        json.add("constraints", constraints);

        return json;
    }

    private static JsonObject findingToJson(Finding finding) {
        JsonObject json = new JsonObject();
        json.addProperty(ValidationConstants.FIELD_FINDING_ID, finding.id());
        json.addProperty("category", finding.category().wireName());
        json.addProperty("severity", finding.severity().name());
        json.addProperty("title", finding.title());
        json.addProperty("confidence", finding.confidence().wireName());
        json.addProperty("evidence", finding.evidence());
        json.addProperty("file_path", finding.filePath());
        json.addProperty("line_start", finding.lineStart());
        json.addProperty("line_end", finding.lineEnd());
        return json;
    }

    /**
     * Builds the strict JSON schema the validator response must match
     * 
     * @return JSON schema object
     */
    public static JsonObject responseSchema() {
        JsonObject item = new JsonObject();
        item.addProperty("type", "object");

        JsonObject itemProperties = new JsonObject();
        itemProperties.add(ValidationConstants.FIELD_FINDING_ID, typed("string"));
        itemProperties.add(ValidationConstants.FIELD_IS_TRUE_POSITIVE, typed("boolean"));
        JsonObject severity = typed("string");
        JsonArray severities = new JsonArray();
        for (Severity value : Severity.values()) {
            severities.add(value.name());
        }
        severity.add("enum", severities);
        itemProperties.add(ValidationConstants.FIELD_FINAL_SEVERITY, severity);
        itemProperties.add(ValidationConstants.FIELD_REASON, typed("string"));
        JsonObject mitigation = typed("array");
        mitigation.add("items", typed("string"));
        itemProperties.add(ValidationConstants.FIELD_MITIGATION, mitigation);
        item.add("properties", itemProperties);
        item.add("required", names(
                ValidationConstants.FIELD_FINDING_ID,
                ValidationConstants.FIELD_IS_TRUE_POSITIVE,
                ValidationConstants.FIELD_FINAL_SEVERITY,
                ValidationConstants.FIELD_REASON,
                ValidationConstants.FIELD_MITIGATION));
        item.addProperty("additionalProperties", false);

        JsonObject validatedFindings = typed("array");
        validatedFindings.add("items", item);

        JsonObject properties = new JsonObject();
        properties.add(ValidationConstants.FIELD_VALIDATED_FINDINGS, validatedFindings);
        properties.add(ValidationConstants.FIELD_SECURITY_SUMMARY, typed("string"));

        JsonObject schema = typed("object");
        schema.add("properties", properties);
        schema.add("required", names(
                ValidationConstants.FIELD_VALIDATED_FINDINGS,
                ValidationConstants.FIELD_SECURITY_SUMMARY));
        schema.addProperty("additionalProperties", false);
        return schema;
    }

    private static JsonObject typed(String type) {
        JsonObject json = new JsonObject();
        json.addProperty("type", type);
        return json;
    }

    private static JsonArray names(String... values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }

    /**
     * Private constructor to prevent instantiation of utility class.
     */
    private ValidationJsonMapper() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
