package com.arqsz.skillsense.service;

import static com.arqsz.skillsense.testutil.TestConstants.PIPE_EXEC_SCRIPT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.arqsz.skillsense.config.FailureMode;
import com.arqsz.skillsense.model.AnalysisReport;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.model.Severity;
import com.arqsz.skillsense.model.ValidatedFinding;
import com.arqsz.skillsense.model.ValidatedSecurity;
import com.arqsz.skillsense.report.ResultAssembler;
import com.arqsz.skillsense.scanner.SecurityScanner;
import com.arqsz.skillsense.testutil.TestConstants;
import com.arqsz.skillsense.validation.EscalationPolicy;
import com.arqsz.skillsense.validation.FindingValidator;
import com.arqsz.skillsense.validation.ValidationException;
import com.arqsz.skillsense.validation.ValidationOrchestrator;
import com.arqsz.skillsense.validation.ValidationRequest;

@DisplayName("AnalysisService")
class AnalysisServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00.750Z"), ZoneOffset.UTC);

    private static final List<ScannedFile> RISKY = List.of(new ScannedFile("script.sh", PIPE_EXEC_SCRIPT));
    private static final List<ScannedFile> BENIGN = List.of(new ScannedFile("SKILL.md", "Summarizes notes."));

    private FindingValidator validator;

    @BeforeEach
    void setUp() {
        validator = mock(FindingValidator.class);
    }

    private AnalysisService service(FailureMode mode) {
        return new AnalysisService(
                new SecurityScanner(),
                new EscalationPolicy(),
                new ValidationOrchestrator(validator),
                new ResultAssembler(),
                mode,
                CLOCK);
    }

    private void validatorConfirmsFirstFinding() throws ValidationException {
        when(validator.validate(any(ValidationRequest.class))).thenAnswer(invocation -> {
            ValidationRequest request = invocation.getArgument(0);
            return new ValidatedSecurity(List.of(new ValidatedFinding(
                    request.findings().get(0).id(),
                    true,
                    Severity.CRITICAL,
                    "Remote code is executed unverified.",
                    List.of("Download, verify and then run the script."))),
                    "Remote script execution confirmed.");
        });
    }

    @Nested
    @DisplayName("Deterministic analysis")
    class Deterministic {

        @Test
        @DisplayName("should skip validation when not requested")
        void shouldSkipValidationWhenNotRequested() throws Exception {
            AnalysisReport report = service(FailureMode.FAIL_UNIT).analyze(RISKY, false);

            assertThat(report.llmUsed()).isFalse();
            assertThat(report.llmModel()).isNull();
            assertThat(report.riskScore()).isGreaterThanOrEqualTo(100);
            verifyNoInteractions(validator);
        }

        @Test
        @DisplayName("should skip validation when nothing needs escalation")
        void shouldSkipValidationWithoutEscalation() throws Exception {
            AnalysisReport report = service(FailureMode.FAIL_UNIT).analyze(BENIGN, true);

            assertThat(report.llmUsed()).isFalse();
            assertThat(report.trustBadge()).isEqualTo("Verified Safe");
            verifyNoInteractions(validator);
        }

        @Test
        @DisplayName("should stamp the analysis time at second precision")
        void shouldStampAnalysisTime() throws Exception {
            AnalysisReport report = service(FailureMode.FAIL_UNIT).analyze(BENIGN, false);

            assertThat(report.analyzedAt()).isEqualTo(TestConstants.FIXED_INSTANT);
        }
    }

    @Nested
    @DisplayName("Validated analysis")
    class Validated {

        @Test
        @DisplayName("should merge validator output for escalated scans")
        void shouldMergeValidatorOutput() throws Exception {
            validatorConfirmsFirstFinding();

            AnalysisReport report = service(FailureMode.FAIL_UNIT).analyze(RISKY, true);

            assertThat(report.llmUsed()).isTrue();
            assertThat(report.llmModel()).isEqualTo("o4-mini");
            assertThat(report.securitySummary()).isEqualTo("Remote script execution confirmed.");
            assertThat(report.validatedFindings()).hasSize(1);
            assertThat(report.userExplanation().recommendedActions())
                    .containsExactly("Download, verify and then run the script.");
            verify(validator).validate(any(ValidationRequest.class));
        }

        @Test
        @DisplayName("should fail the unit when validation fails")
        void shouldFailUnit() throws Exception {
            ValidationException failure = new ValidationException(
                    ValidationException.Kind.HTTP_STATUS, "Validator returned HTTP 500: boom");
            when(validator.validate(any(ValidationRequest.class))).thenThrow(failure);

            assertThatThrownBy(() -> service(FailureMode.FAIL_UNIT).analyze(RISKY, true))
                    .isInstanceOf(AnalysisFailedException.class)
                    .hasMessage("Validator returned HTTP 500: boom")
                    .hasCause(failure);
        }

        @Test
        @DisplayName("should truncate long failure messages")
        void shouldTruncateFailureMessages() throws Exception {
            when(validator.validate(any(ValidationRequest.class))).thenThrow(
                    new ValidationException(ValidationException.Kind.HTTP_STATUS, "x".repeat(5000)));

            assertThatThrownBy(() -> service(FailureMode.FAIL_UNIT).analyze(RISKY, true))
                    .isInstanceOf(AnalysisFailedException.class)
                    .satisfies(e -> assertThat(e.getMessage()).hasSize(1000));
        }

        @Test
        @DisplayName("should fall back to the deterministic record in degrade mode")
        void shouldDegrade() throws Exception {
            when(validator.validate(any(ValidationRequest.class))).thenThrow(
                    new ValidationException(ValidationException.Kind.TIMEOUT, "timed out"));

            AnalysisReport report = service(FailureMode.DEGRADE).analyze(RISKY, true);

            assertThat(report.llmUsed()).isFalse();
            assertThat(report.securitySummary()).isNull();
            assertThat(report.trustBadge()).isEqualTo("Not Recommended");
            assertThat(report.findings()).isNotEmpty();
        }
    }
}
