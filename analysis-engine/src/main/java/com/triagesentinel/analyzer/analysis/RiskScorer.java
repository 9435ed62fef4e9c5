package com.triagesentinel.analyzer.analysis;

import java.util.List;

/**
 * Fixed, additive risk model.
 *
 * <pre>
 * signature match present          +50
 * executable flag present          +35   (suspicious import, high-entropy section, packed)
 * network indicator present        +15
 * </pre>
 *
 * <p>
 * Containers take the maximum of their children's scores; child scores are
 * never summed.
 * </p>
 *
 * @author Naveed Gung
 */
public final class RiskScorer {

    public static final int SIGNATURE_WEIGHT = 50;
    public static final int EXECUTABLE_WEIGHT = 35;
    public static final int INDICATOR_WEIGHT = 15;

    private RiskScorer() {
    }

    public static RiskAssessment scoreLeaf(boolean signatureMatched, boolean executableFlagged,
            boolean indicatorsFound) {
        int score = 0;
        if (signatureMatched) {
            score += SIGNATURE_WEIGHT;
        }
        if (executableFlagged) {
            score += EXECUTABLE_WEIGHT;
        }
        if (indicatorsFound) {
            score += INDICATOR_WEIGHT;
        }
        return RiskAssessment.of(score);
    }

    public static RiskAssessment scoreContainer(List<AnalysisResult> children) {
        int max = 0;
        for (AnalysisResult child : children) {
            if (child.risk() != null) {
                max = Math.max(max, child.risk().score());
            }
        }
        return RiskAssessment.of(max);
    }
}
