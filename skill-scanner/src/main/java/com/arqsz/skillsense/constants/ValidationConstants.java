package com.arqsz.skillsense.constants;

/**
 * Constants for the external finding validator
 */
public final class ValidationConstants {

    public static final int MAX_CONTEXT_SNIPPETS = 20;
    public static final int SNIPPET_MAX_LENGTH = 600;

    public static final int REASON_MAX_SENTENCES = 2;
    public static final int MITIGATION_MAX_ITEMS = 3;
    public static final int SECURITY_SUMMARY_MAX_WORDS = 60;

    public static final int ESCALATION_MIN_HIGH_FINDINGS = 2;
    public static final int ESCALATION_MIN_RISK_SCORE = 20;

    public static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1/responses";
    public static final String DEFAULT_MODEL = "o4-mini";
    public static final String ESCALATED_MODEL = "gpt-5.1";
    public static final String ESCALATED_REASONING_EFFORT = "low";
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 700;

    public static final String TASK = "Validate deterministic findings and provide final severity and mitigations.";
    public static final String SYSTEM_INSTRUCTION = "You are a security validation assistant. "
            + "Output only JSON that matches the schema exactly. "
            + "Do not add new findings. Only validate items provided. "
            + "If uncertain, mark is_true_positive=false and explain why.";
    public static final String SCHEMA_NAME = "validated_security_output";
    public static final String NO_FINDINGS_SUMMARY = "No findings to validate.";

    public static final String FIELD_VALIDATED_FINDINGS = "validated_findings";
    public static final String FIELD_SECURITY_SUMMARY = "security_summary";
    public static final String FIELD_FINDING_ID = "finding_id";
    public static final String FIELD_IS_TRUE_POSITIVE = "is_true_positive";
    public static final String FIELD_FINAL_SEVERITY = "final_severity";
    public static final String FIELD_REASON = "reason";
    public static final String FIELD_MITIGATION = "mitigation";

    public static final String ENVELOPE_OUTPUT = "output";
    public static final String ENVELOPE_CONTENT = "content";
    public static final String ENVELOPE_TYPE = "type";
    public static final String ENVELOPE_TEXT = "text";
    public static final String ENVELOPE_JSON = "json";
    public static final String ENVELOPE_OUTPUT_TEXT = "output_text";
    public static final String ENVELOPE_OUTPUT_JSON = "output_json";

    private ValidationConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
