package com.arqsz.skillsense.validation;

import static com.arqsz.skillsense.testutil.FindingBuilder.aFinding;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.arqsz.skillsense.model.Category;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.model.Severity;
import com.arqsz.skillsense.model.ValidatorProfile;
import com.arqsz.skillsense.model.ValidatorProfile.Tier;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

@DisplayName("ValidationJsonMapper")
class ValidationJsonMapperTest {

    private ValidationRequest request(Finding finding) {
        return new ValidationRequestBuilder().build(
                List.of(finding),
                List.of(new ScannedFile(finding.filePath(), "import os\nos.system(cmd)")),
                25,
                new ValidatorProfile(Tier.DEFAULT, "model", null));
    }

    @Test
    @DisplayName("should describe the task, score, counts and constraints")
    void shouldMapTaskPayload() {
        JsonObject payload = ValidationJsonMapper.toTaskPayload(request(aFinding().withSeverity(Severity.HIGH).build()));

        assertThat(payload.get("task").getAsString()).startsWith("Validate deterministic findings");
        assertThat(payload.get("risk_score").getAsInt()).isEqualTo(25);
        assertThat(payload.getAsJsonObject("severity_counts").keySet())
                .containsExactly("CRITICAL", "HIGH", "MEDIUM", "LOW");
        assertThat(payload.getAsJsonObject("severity_counts").get("HIGH").getAsInt()).isEqualTo(1);

        JsonObject constraints = payload.getAsJsonObject("constraints");
        assertThat(constraints.get("reason_max_sentences").getAsInt()).isEqualTo(2);
        assertThat(constraints.get("mitigation_max_items").getAsInt()).isEqualTo(3);
        assertThat(constraints.get("security_summary_max_words").getAsInt()).isEqualTo(60);
    }

    @Test
    @DisplayName("should map findings with wire names")
    void shouldMapFindings() {
        Finding finding = aFinding()
                .withId("SEC_PY_OS_SYSTEM_001_0a1b2c3d")
                .withCategory(Category.PROMPT_INJECTION)
                .withLine(null)
                .build();

        JsonObject json = ValidationJsonMapper.toTaskPayload(request(finding))
                .getAsJsonArray("findings").get(0).getAsJsonObject();

        assertThat(json.get("finding_id").getAsString()).isEqualTo("SEC_PY_OS_SYSTEM_001_0a1b2c3d");
        assertThat(json.get("category").getAsString()).isEqualTo("prompt_injection");
        assertThat(json.get("severity").getAsString()).isEqualTo("MEDIUM");
        assertThat(json.get("confidence").getAsString()).isEqualTo("high");
        assertThat(json.get("line_start").isJsonNull()).isTrue();
    }

    @Test
    @DisplayName("should include context snippets")
    void shouldMapSnippets() {
        JsonArray snippets = ValidationJsonMapper.toTaskPayload(request(aFinding().build()))
                .getAsJsonArray("context_snippets");

        assertThat(snippets).hasSize(1);
        JsonObject snippet = snippets.get(0).getAsJsonObject();
        assertThat(snippet.get("file_path").getAsString()).isEqualTo("scripts/run.py");
        assertThat(snippet.get("snippet").getAsString()).isEqualTo("import os\nos.system(cmd)");
    }

    @Test
    @DisplayName("should build a closed response schema")
    void shouldBuildStrictSchema() {
        JsonObject schema = ValidationJsonMapper.responseSchema();

        assertThat(schema.get("additionalProperties").getAsBoolean()).isFalse();
        assertThat(schema.getAsJsonArray("required")).hasSize(2);

        JsonObject item = schema.getAsJsonObject("properties")
                .getAsJsonObject("validated_findings")
                .getAsJsonObject("items");
        assertThat(item.get("additionalProperties").getAsBoolean()).isFalse();
        assertThat(item.getAsJsonObject("properties").keySet()).containsExactlyInAnyOrder(
                "finding_id", "is_true_positive", "final_severity", "reason", "mitigation");
        assertThat(item.getAsJsonObject("properties").getAsJsonObject("final_severity").getAsJsonArray("enum"))
                .hasSize(4);
    }
}
