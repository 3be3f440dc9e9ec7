package com.arqsz.skillsense.scanner;

/**
 * Human-facing label for a risk score. Each bucket starts at its minimum score, inclusive.
 */
public enum TrustBadge {
    VERIFIED_SAFE("Verified Safe", 0),
    GENERALLY_SAFE("Generally Safe", 5),
    REVIEW_RECOMMENDED("Review Recommended", 20),
    USE_WITH_CAUTION("Use With Caution", 50),
    NOT_RECOMMENDED("Not Recommended", 100);

    private final String label;
    private final int minScore;

    TrustBadge(String label, int minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    public String label() {
        return label;
    }

    public int minScore() {
        return minScore;
    }

    /**
     * Maps a risk score to its badge
     * 
     * @param riskScore The risk score
     * @return The highest badge whose minimum does not exceed the score
     */
    public static TrustBadge forScore(int riskScore) {
        TrustBadge badge = VERIFIED_SAFE;
        for (TrustBadge candidate : values()) {
            if (riskScore >= candidate.minScore) {
                badge = candidate;
            }
        }
        return badge;
    }
}
