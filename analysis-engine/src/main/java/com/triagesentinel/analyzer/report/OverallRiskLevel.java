package com.triagesentinel.analyzer.report;

/**
 * Job-level risk ladder used in reports. Coarser than the per-artifact
 * bands and inclusive at each cut point.
 *
 * <pre>
 * score >= 140  CRITICAL
 * score >= 100  HIGH
 * score >= 60   MEDIUM
 * score >= 30   LOW
 * otherwise     INFO
 * </pre>
 *
 * @author Naveed Gung
 */
public enum OverallRiskLevel {

    CRITICAL(140, "red"),
    HIGH(100, "orange"),
    MEDIUM(60, "yellow"),
    LOW(30, "green"),
    INFO(0, "blue");

    private final int threshold;
    private final String badgeColor;

    OverallRiskLevel(int threshold, String badgeColor) {
        this.threshold = threshold;
        this.badgeColor = badgeColor;
    }

    public int getThreshold() {
        return threshold;
    }

    public String getBadgeColor() {
        return badgeColor;
    }

    public static OverallRiskLevel fromScore(int score) {
        for (OverallRiskLevel level : values()) {
            if (score >= level.threshold) {
                return level;
            }
        }
        return INFO;
    }
}
