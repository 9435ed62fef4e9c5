package com.triagesentinel.analyzer.analysis;

/**
 * Per-artifact risk band and the action it recommends.
 *
 * @author Naveed Gung
 */
public enum RiskLevel {

    LOW(Recommendation.MONITOR),
    MEDIUM(Recommendation.MONITOR),
    HIGH(Recommendation.QUARANTINE);

    public enum Recommendation {
        MONITOR, QUARANTINE
    }

    private final Recommendation recommendation;

    RiskLevel(Recommendation recommendation) {
        this.recommendation = recommendation;
    }

    public Recommendation getRecommendation() {
        return recommendation;
    }

    /** Strict cut points: 71 and above is HIGH, 41 to 70 MEDIUM. */
    public static RiskLevel fromScore(int score) {
        if (score > 70) {
            return HIGH;
        }
        if (score > 40) {
            return MEDIUM;
        }
        return LOW;
    }
}
