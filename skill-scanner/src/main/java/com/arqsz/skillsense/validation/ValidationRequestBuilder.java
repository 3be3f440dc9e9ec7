package com.arqsz.skillsense.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.arqsz.skillsense.constants.ValidationConstants;
import com.arqsz.skillsense.model.ContextSnippet;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.model.Severity;
import com.arqsz.skillsense.model.ValidatorProfile;
import com.arqsz.skillsense.util.TextUtils;

/**
 * Builds the bounded validator input from a scan
 */
public class ValidationRequestBuilder {

    /**
     * Builds a validation request
     * 
     * @param findings  All findings of the scan
     * @param files     The scanned files, in submission order
     * @param riskScore The scan risk score
     * @param profile   The selected validator profile
     * @return The request
     */
    public ValidationRequest build(
            List<Finding> findings,
            List<ScannedFile> files,
            int riskScore,
            ValidatorProfile profile) {
        return new ValidationRequest(
                findings,
                severityCounts(findings),
                riskScore,
                contextSnippets(findings, files),
                profile);
    }

    /**
     * Counts findings per severity
     * 
     * @param findings The findings
     * @return Counts for all four severities, CRITICAL first
     */
    public Map<Severity, Integer> severityCounts(List<Finding> findings) {
        Map<Severity, Integer> counts = new LinkedHashMap<>();
        counts.put(Severity.CRITICAL, 0);
        counts.put(Severity.HIGH, 0);
        counts.put(Severity.MEDIUM, 0);
        counts.put(Severity.LOW, 0);
        for (Finding finding : findings) {
            counts.merge(finding.severity(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * One leading excerpt per file with findings, in file order, capped in count and length
     * 
     * @param findings The findings
     * @param files    The scanned files
     * @return Context snippets
     */
    public List<ContextSnippet> contextSnippets(List<Finding> findings, List<ScannedFile> files) {
        Set<String> referenced = new HashSet<>();
        for (Finding finding : findings) {
            referenced.add(finding.filePath());
        }

        List<ContextSnippet> snippets = new ArrayList<>();
        Set<String> emitted = new HashSet<>();
        for (ScannedFile file : files) {
            if (snippets.size() >= ValidationConstants.MAX_CONTEXT_SNIPPETS) {
                break;
            }
            if (!referenced.contains(file.path()) || !emitted.add(file.path())) {
                continue;
            }
            snippets.add(new ContextSnippet(
                    file.path(),
                    TextUtils.truncate(file.text(), ValidationConstants.SNIPPET_MAX_LENGTH)));
        }
        return snippets;
    }
}
