package com.arqsz.skillsense.scanner;

import java.util.List;

import com.arqsz.skillsense.model.CapabilityFlags;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.ScanResult;
import com.arqsz.skillsense.model.ScannedFile;

/**
 * Deterministic scan of one artifact: findings, score, badge and capabilities.
 * Stateless and safe to share between threads.
 */
public class SecurityScanner {

    private final FindingAssembler findingAssembler;
    private final CapabilityDetector capabilityDetector;
    private final ScoringEngine scoringEngine;

    public SecurityScanner() {
        this(new FindingAssembler(new RuleMatcher(), new ManifestChecks()),
                new CapabilityDetector(),
                new ScoringEngine());
    }

    public SecurityScanner(
            FindingAssembler findingAssembler,
            CapabilityDetector capabilityDetector,
            ScoringEngine scoringEngine) {
        this.findingAssembler = findingAssembler;
        this.capabilityDetector = capabilityDetector;
        this.scoringEngine = scoringEngine;
    }

    /**
     * Scans decoded artifact files
     * 
     * @param files Files in submission order
     * @return The scan result
     */
    public ScanResult scan(List<ScannedFile> files) {
        List<Finding> findings = findingAssembler.assemble(files);
        CapabilityFlags capabilities = capabilityDetector.detect(files);
        int riskScore = scoringEngine.riskScore(findings);
        return new ScanResult(findings, riskScore, scoringEngine.trustBadge(riskScore), capabilities);
    }
}
