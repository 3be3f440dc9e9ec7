package com.arqsz.skillsense.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.arqsz.skillsense.constants.ValidationConstants;
import com.arqsz.skillsense.model.Severity;
import com.arqsz.skillsense.model.ValidatedFinding;
import com.arqsz.skillsense.model.ValidatedSecurity;
import com.arqsz.skillsense.util.StrictJson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

/**
 * Locates the validator payload inside a transport envelope and checks it against the response schema
 */
public class ValidationResponseParser {

    private static final Set<String> TOP_LEVEL_FIELDS = Set.of(
            ValidationConstants.FIELD_VALIDATED_FINDINGS,
            ValidationConstants.FIELD_SECURITY_SUMMARY);

    private static final Set<String> ITEM_FIELDS = Set.of(
            ValidationConstants.FIELD_FINDING_ID,
            ValidationConstants.FIELD_IS_TRUE_POSITIVE,
            ValidationConstants.FIELD_FINAL_SEVERITY,
            ValidationConstants.FIELD_REASON,
            ValidationConstants.FIELD_MITIGATION);

    /**
     * Parses a raw response body
     * 
     * @param body The HTTP response body
     * @return The validated security payload
     * @throws ValidationException if the body cannot be parsed or violates the schema
     */
    public ValidatedSecurity parse(String body) throws ValidationException {
        JsonElement envelope = parseJson(body, "Validator response is not valid JSON");
        if (!envelope.isJsonObject()) {
            throw new ValidationException(ValidationException.Kind.PARSE, "Validator response is not a JSON object");
        }
        return toValidatedSecurity(extractPayload(envelope.getAsJsonObject()));
    }

    /**
     * Finds the payload in the envelope: a nested text or JSON content entry under {@code output},
     * else a flat {@code output_text} string
     * 
     * @param envelope The transport envelope
     * @return The payload JSON
     * @throws ValidationException if no parseable payload is present
     */
    public JsonElement extractPayload(JsonObject envelope) throws ValidationException {
        JsonElement output = envelope.get(ValidationConstants.ENVELOPE_OUTPUT);
        if (output != null && output.isJsonArray()) {
            for (JsonElement item : output.getAsJsonArray()) {
                if (!item.isJsonObject()) {
                    continue;
                }
                JsonElement content = item.getAsJsonObject().get(ValidationConstants.ENVELOPE_CONTENT);
                if (content == null || !content.isJsonArray()) {
                    continue;
                }
                for (JsonElement entry : content.getAsJsonArray()) {
                    if (!entry.isJsonObject()) {
                        continue;
                    }
                    JsonObject entryObject = entry.getAsJsonObject();
                    String type = stringOrNull(entryObject.get(ValidationConstants.ENVELOPE_TYPE));
                    if (ValidationConstants.ENVELOPE_OUTPUT_TEXT.equals(type)
                            || ValidationConstants.ENVELOPE_TEXT.equals(type)) {
                        String text = stringOrNull(entryObject.get(ValidationConstants.ENVELOPE_TEXT));
                        if (text != null) {
                            return parseJson(text, "Validator output text is not valid JSON");
                        }
                    }
                    if (ValidationConstants.ENVELOPE_OUTPUT_JSON.equals(type)) {
                        JsonElement json = entryObject.get(ValidationConstants.ENVELOPE_JSON);
                        if (json != null && json.isJsonObject()) {
                            return json;
                        }
                    }
                }
            }
        }

        String outputText = stringOrNull(envelope.get(ValidationConstants.ENVELOPE_OUTPUT_TEXT));
        if (outputText != null) {
            return parseJson(outputText, "Validator output_text is not valid JSON");
        }
        throw new ValidationException(
                ValidationException.Kind.PARSE, "Validator response did not contain parseable JSON output.");
    }

    /**
     * Checks a payload against the strict response schema
     * 
     * @param payload The extracted payload
     * @return The validated security payload
     * @throws ValidationException with kind SCHEMA on any violation
     */
    public ValidatedSecurity toValidatedSecurity(JsonElement payload) throws ValidationException {
        if (!payload.isJsonObject()) {
            throw schema("payload must be an object");
        }
        JsonObject object = payload.getAsJsonObject();
        requireExactFields(object, TOP_LEVEL_FIELDS, "payload");

        JsonElement items = object.get(ValidationConstants.FIELD_VALIDATED_FINDINGS);
        if (!items.isJsonArray()) {
            throw schema(ValidationConstants.FIELD_VALIDATED_FINDINGS + " must be an array");
        }
        String summary = requireString(object, ValidationConstants.FIELD_SECURITY_SUMMARY, "payload");

        List<ValidatedFinding> validated = new ArrayList<>();
        JsonArray array = items.getAsJsonArray();
        for (int i = 0; i < array.size(); i++) {
            validated.add(toValidatedFinding(array.get(i), ValidationConstants.FIELD_VALIDATED_FINDINGS + "[" + i + "]"));
        }
        return new ValidatedSecurity(validated, summary);
    }

    private ValidatedFinding toValidatedFinding(JsonElement element, String location) throws ValidationException {
        if (!element.isJsonObject()) {
            throw schema(location + " must be an object");
        }
        JsonObject item = element.getAsJsonObject();
        requireExactFields(item, ITEM_FIELDS, location);

        String findingId = requireString(item, ValidationConstants.FIELD_FINDING_ID, location);
        JsonElement truePositive = item.get(ValidationConstants.FIELD_IS_TRUE_POSITIVE);
        if (!isPrimitive(truePositive) || !truePositive.getAsJsonPrimitive().isBoolean()) {
            throw schema(location + "." + ValidationConstants.FIELD_IS_TRUE_POSITIVE + " must be a boolean");
        }
        String severityName = requireString(item, ValidationConstants.FIELD_FINAL_SEVERITY, location);
        Severity severity;
        try {
            severity = Severity.valueOf(severityName);
        } catch (IllegalArgumentException e) {
            throw schema(location + "." + ValidationConstants.FIELD_FINAL_SEVERITY + " has unknown value " + severityName);
        }
        String reason = requireString(item, ValidationConstants.FIELD_REASON, location);

        JsonElement mitigationElement = item.get(ValidationConstants.FIELD_MITIGATION);
        if (!mitigationElement.isJsonArray()) {
            throw schema(location + "." + ValidationConstants.FIELD_MITIGATION + " must be an array");
        }
        List<String> mitigation = new ArrayList<>();
        for (JsonElement bullet : mitigationElement.getAsJsonArray()) {
            if (!isPrimitive(bullet) || !bullet.getAsJsonPrimitive().isString()) {
                throw schema(location + "." + ValidationConstants.FIELD_MITIGATION + " must contain only strings");
            }
            mitigation.add(bullet.getAsString());
        }

        return new ValidatedFinding(findingId, truePositive.getAsBoolean(), severity, reason, mitigation);
    }

    private static void requireExactFields(JsonObject object, Set<String> fields, String location)
            throws ValidationException {
        for (String key : object.keySet()) {
            if (!fields.contains(key)) {
                throw schema(location + " has unexpected property " + key);
            }
        }
        for (String field : fields) {
            if (!object.has(field)) {
                throw schema(location + " is missing required property " + field);
            }
        }
    }

    private static String requireString(JsonObject object, String field, String location) throws ValidationException {
        JsonElement value = object.get(field);
        if (!isPrimitive(value) || !value.getAsJsonPrimitive().isString()) {
            throw schema(location + "." + field + " must be a string");
        }
        return value.getAsString();
    }

    private static boolean isPrimitive(JsonElement element) {
        return element != null && element.isJsonPrimitive();
    }

    private static String stringOrNull(JsonElement element) {
        if (element instanceof JsonPrimitive primitive && primitive.isString()) {
            return primitive.getAsString();
        }
        return null;
    }

    private static JsonElement parseJson(String text, String message) throws ValidationException {
        try {
            return StrictJson.parse(text);
        } catch (JsonParseException e) {
            throw new ValidationException(ValidationException.Kind.PARSE, message, e);
        }
    }

    private static ValidationException schema(String message) {
        return new ValidationException(ValidationException.Kind.SCHEMA, "Validator response violates schema: " + message);
    }
}
