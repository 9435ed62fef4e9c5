package com.triagesentinel.analyzer.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Score, band and recommended action for one node of an analysis tree.
 *
 * @param score          non-negative additive score
 * @param level          band derived from the score
 * @param recommendation action derived from the band
 *
 * @author Naveed Gung
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskAssessment(int score, RiskLevel level, RiskLevel.Recommendation recommendation) {

    public static final RiskAssessment NONE = of(0);

    public static RiskAssessment of(int score) {
        if (score < 0) {
            throw new IllegalArgumentException("Risk score must be non-negative: " + score);
        }
        RiskLevel level = RiskLevel.fromScore(score);
        return new RiskAssessment(score, level, level.getRecommendation());
    }
}
