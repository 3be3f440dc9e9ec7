package com.arqsz.skillsense.scanner;

import java.util.ArrayList;
import java.util.List;

import com.arqsz.skillsense.constants.ScanConstants;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.Rule;
import com.arqsz.skillsense.model.RuleMatch;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.util.TextUtils;

/**
 * Turns rule matches into findings and appends manifest-check findings.
 * <p>
 * Output order: file by file in submission order; within a file, rule matches in
 * catalog and discovery order, then manifest findings.
 */
public class FindingAssembler {

    private final RuleMatcher matcher;
    private final ManifestChecks manifestChecks;

    public FindingAssembler(RuleMatcher matcher, ManifestChecks manifestChecks) {
        this.matcher = matcher;
        this.manifestChecks = manifestChecks;
    }

    /**
     * Produces all findings for an artifact
     * 
     * @param files Files in submission order
     * @return Findings in reproducible order
     */
    public List<Finding> assemble(List<ScannedFile> files) {
        List<Finding> findings = new ArrayList<>();
        for (ScannedFile file : files) {
            for (RuleMatch match : matcher.matchFile(file)) {
                findings.add(toFinding(match));
            }
            findings.addAll(manifestChecks.check(file));
        }
        return findings;
    }

    /**
     * Converts one rule match into a finding
     * 
     * @param match The raw match
     * @return Finding with a stable id and normalized evidence
     */
    public Finding toFinding(RuleMatch match) {
        Rule rule = match.rule();
        String evidence = TextUtils.truncate(
                TextUtils.collapseWhitespace(match.window()), ScanConstants.EVIDENCE_MAX_LENGTH);
        Integer line = match.lineNumber();

        return new Finding(
                FindingIdGenerator.generate(rule.id(), match.filePath(), line, evidence),
                rule.category(),
                rule.severity(),
                rule.title(),
                evidence,
                match.filePath(),
                line,
                line,
                rule.confidence());
    }
}
