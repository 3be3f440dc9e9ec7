package com.arqsz.skillsense.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.constants.ValidationConstants;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.model.ValidatedFinding;
import com.arqsz.skillsense.model.ValidatedSecurity;
import com.arqsz.skillsense.model.ValidatorProfile;

/**
 * Sends escalated findings to the injected validator and merges its verdicts.
 * Verdicts for ids that were not submitted are dropped, so the validator can never introduce findings.
 */
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    private final FindingValidator validator;
    private final ValidationRequestBuilder requestBuilder;

    public ValidationOrchestrator(FindingValidator validator) {
        this(validator, new ValidationRequestBuilder());
    }

    public ValidationOrchestrator(FindingValidator validator, ValidationRequestBuilder requestBuilder) {
        this.validator = validator;
        this.requestBuilder = requestBuilder;
    }

    /**
     * Validates findings of one scan
     * 
     * @param findings  Findings to validate
     * @param files     Scanned files, used for context snippets
     * @param riskScore The scan risk score
     * @param profile   The validator profile to use
     * @return Verdicts restricted to submitted findings
     * @throws ValidationException if the validator call fails in any way
     */
    public ValidatedSecurity validate(
            List<Finding> findings,
            List<ScannedFile> files,
            int riskScore,
            ValidatorProfile profile) throws ValidationException {
        if (findings.isEmpty()) {
            return new ValidatedSecurity(List.of(), ValidationConstants.NO_FINDINGS_SUMMARY);
        }

        ValidationRequest request = requestBuilder.build(findings, files, riskScore, profile);
        log.info("Validating {} finding(s) with model {} (effort: {})",
                findings.size(), profile.model(), profile.reasoningEffort() == null ? "default" : profile.reasoningEffort());

        ValidatedSecurity response = validator.validate(request);
        return restrictToSubmitted(response, findings);
    }

    /**
     * Drops verdicts whose finding id was not part of the submitted set
     * 
     * @param response  The validator response
     * @param submitted The submitted findings
     * @return Response holding only known verdicts
     */
    ValidatedSecurity restrictToSubmitted(ValidatedSecurity response, List<Finding> submitted) {
        Set<String> submittedIds = new HashSet<>();
        for (Finding finding : submitted) {
            submittedIds.add(finding.id());
        }

        List<ValidatedFinding> known = new ArrayList<>();
        for (ValidatedFinding verdict : response.validatedFindings()) {
            if (submittedIds.contains(verdict.findingId())) {
                known.add(verdict);
            } else {
                log.warn("Ignoring verdict for unknown finding id {}", verdict.findingId());
            }
        }
        return new ValidatedSecurity(known, response.securitySummary());
    }
}
