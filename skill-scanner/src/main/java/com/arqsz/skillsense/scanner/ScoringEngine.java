package com.arqsz.skillsense.scanner;

import java.util.List;

import com.arqsz.skillsense.constants.ScanConstants;
import com.arqsz.skillsense.model.Finding;

/**
 * Aggregates findings into a capped risk score and trust badge
 */
public class ScoringEngine {

    /**
     * Sums severity weights, capped at {@link ScanConstants#MAX_RISK_SCORE}
     * 
     * @param findings The findings to score
     * @return Risk score between 0 and the cap
     */
    public int riskScore(List<Finding> findings) {
        long total = 0;
        for (Finding finding : findings) {
            total += ScanConstants.SEVERITY_WEIGHTS.get(finding.severity());
        }
        return (int) Math.min(ScanConstants.MAX_RISK_SCORE, total);
    }

    /**
     * Gets the badge label for a risk score
     * 
     * @param riskScore The risk score
     * @return Badge label
     */
    public String trustBadge(int riskScore) {
        return TrustBadge.forScore(riskScore).label();
    }

    /**
     * Converts a risk score into a 0-100 overall score
     * 
     * @param riskScore The risk score
     * @return {@code max(0, 100 - min(riskScore, 100))}
     */
    public double overallScore(int riskScore) {
        return Math.max(0.0, 100.0 - Math.min(riskScore, 100));
    }
}
