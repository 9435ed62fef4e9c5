package com.triagesentinel.analyzer.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskScorerTest {

    @Test
    void shouldAddFacetWeights() {
        assertEquals(0, RiskScorer.scoreLeaf(false, false, false).score());
        assertEquals(50, RiskScorer.scoreLeaf(true, false, false).score());
        assertEquals(35, RiskScorer.scoreLeaf(false, true, false).score());
        assertEquals(15, RiskScorer.scoreLeaf(false, false, true).score());
        assertEquals(100, RiskScorer.scoreLeaf(true, true, true).score());
    }

    @Test
    void shouldUseStrictBandBoundaries() {
        assertEquals(RiskLevel.LOW, RiskLevel.fromScore(40));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(41));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(70));
        assertEquals(RiskLevel.HIGH, RiskLevel.fromScore(71));
    }

    @Test
    void shouldRecommendQuarantineOnlyForHigh() {
        assertEquals(RiskLevel.Recommendation.MONITOR, RiskAssessment.of(50).recommendation());
        assertEquals(RiskLevel.Recommendation.MONITOR, RiskAssessment.of(65).recommendation());
        assertEquals(RiskLevel.Recommendation.QUARANTINE, RiskAssessment.of(85).recommendation());
    }

    @Test
    void shouldTakeMaximumOverChildrenWithoutSumming() {
        List<AnalysisResult> children = List.of(node("a", 50), node("b", 35), node("c", 15));

        RiskAssessment risk = RiskScorer.scoreContainer(children);

        assertEquals(50, risk.score());
        assertEquals(RiskLevel.MEDIUM, risk.level());
    }

    @Test
    void shouldScoreEmptyContainerAsZero() {
        assertEquals(RiskAssessment.NONE, RiskScorer.scoreContainer(List.of()));
    }

    @Test
    void shouldRejectNegativeScore() {
        assertThrows(IllegalArgumentException.class, () -> RiskAssessment.of(-1));
    }

    private static AnalysisResult node(String name, int score) {
        FileInfo info = new FileInfo(name.repeat(64).substring(0, 64), name, "text/plain", 1L);
        return new AnalysisResult("static_x", info, ArtifactKind.GENERIC, null, null, null, null,
                RiskAssessment.of(score), null, null, null, 0);
    }
}
