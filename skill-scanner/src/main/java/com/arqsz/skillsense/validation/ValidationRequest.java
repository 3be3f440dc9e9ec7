package com.arqsz.skillsense.validation;

import java.util.List;
import java.util.Map;

import com.arqsz.skillsense.model.ContextSnippet;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.Severity;
import com.arqsz.skillsense.model.ValidatorProfile;

/**
 * Bounded input for one validator call
 * 
 * @param severityCounts Count per severity, CRITICAL first
 */
public record ValidationRequest(
        List<Finding> findings,
        Map<Severity, Integer> severityCounts,
        int riskScore,
        List<ContextSnippet> contextSnippets,
        ValidatorProfile profile) {

    public ValidationRequest {
        findings = List.copyOf(findings);
        contextSnippets = List.copyOf(contextSnippets);
    }
}
