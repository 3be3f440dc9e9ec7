package com.arqsz.skillsense.service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.config.FailureMode;
import com.arqsz.skillsense.config.ScannerSettings;
import com.arqsz.skillsense.model.AnalysisReport;
import com.arqsz.skillsense.model.ScanResult;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.model.ValidatedSecurity;
import com.arqsz.skillsense.model.ValidatorProfile;
import com.arqsz.skillsense.report.ResultAssembler;
import com.arqsz.skillsense.scanner.SecurityScanner;
import com.arqsz.skillsense.validation.EscalationPolicy;
import com.arqsz.skillsense.validation.OpenAiFindingValidator;
import com.arqsz.skillsense.validation.ValidationException;
import com.arqsz.skillsense.validation.ValidationOrchestrator;

/**
 * Runs one analysis unit: scan, escalation decision, optional validation and result assembly
 */
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final SecurityScanner scanner;
    private final EscalationPolicy escalationPolicy;
    private final ValidationOrchestrator orchestrator;
    private final ResultAssembler resultAssembler;
    private final FailureMode failureMode;
    private final Clock clock;

    public AnalysisService(
            SecurityScanner scanner,
            EscalationPolicy escalationPolicy,
            ValidationOrchestrator orchestrator,
            ResultAssembler resultAssembler,
            FailureMode failureMode,
            Clock clock) {
        this.scanner = scanner;
        this.escalationPolicy = escalationPolicy;
        this.orchestrator = orchestrator;
        this.resultAssembler = resultAssembler;
        this.failureMode = failureMode;
        this.clock = clock;
    }

    /**
     * Wires the production collaborators from settings
     * 
     * @param settings The scanner settings
     * @return A ready analysis service
     */
    public static AnalysisService fromSettings(ScannerSettings settings) {
        return new AnalysisService(
                new SecurityScanner(),
                new EscalationPolicy(
                        settings.getValidatorDefaultModel(),
                        settings.getValidatorEscalatedModel(),
                        settings.getValidatorEscalatedEffort()),
                new ValidationOrchestrator(new OpenAiFindingValidator(settings)),
                new ResultAssembler(),
                settings.getFailureMode(),
                Clock.systemUTC());
    }

    /**
     * Analyzes one artifact
     * 
     * @param files    The artifact files
     * @param validate Whether escalated findings may be sent to the validator
     * @return The final analysis record
     * @throws AnalysisFailedException if validation fails in {@link FailureMode#FAIL_UNIT} mode
     */
    public AnalysisReport analyze(List<ScannedFile> files, boolean validate) throws AnalysisFailedException {
        ScanResult scan = scanner.scan(files);
        String analyzedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();

        if (!validate) {
            return resultAssembler.assemble(scan, null, null, analyzedAt);
        }

        boolean escalate = escalationPolicy.shouldEscalate(scan.findings(), scan.riskScore());
        log.info("Scan produced {} finding(s), risk score {}, escalation {}",
                scan.findings().size(), scan.riskScore(), escalate ? "required" : "not required");
        if (!escalate) {
            return resultAssembler.assemble(scan, null, null, analyzedAt);
        }

        ValidatorProfile profile = escalationPolicy.selectValidatorProfile(scan.findings());
        log.info("Validating with model {} (effort {})", profile.model(),
                profile.reasoningEffort() == null ? "default" : profile.reasoningEffort());
        try {
            ValidatedSecurity validated = orchestrator.validate(scan.findings(), files, scan.riskScore(), profile);
            return resultAssembler.assemble(scan, validated, profile.model(), analyzedAt);
        } catch (ValidationException e) {
            log.warn("Validation failed ({}): {}", e.getKind(), e.getMessage());
            if (failureMode == FailureMode.DEGRADE) {
                return resultAssembler.assemble(scan, null, null, analyzedAt);
            }
            throw new AnalysisFailedException(e.getMessage(), e);
        }
    }
}
