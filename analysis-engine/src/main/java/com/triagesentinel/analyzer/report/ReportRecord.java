package com.triagesentinel.analyzer.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.triagesentinel.analyzer.analysis.AnalysisResult;
import com.triagesentinel.analyzer.queue.JobEntry;

import java.time.Instant;

/**
 * Final merge of a job and its analysis document. Written once, never
 * rewritten.
 *
 * @param reportId       {@code report-<hash>}
 * @param generatedAt    when the record was built
 * @param fileInfo       job and artifact identity
 * @param staticAnalysis the analysis document, or null when it could not be
 *                       read
 * @param overallRisk    job-level score and ladder level
 *
 * @author Naveed Gung
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportRecord(
        String reportId,
        Instant generatedAt,
        ReportFileInfo fileInfo,
        AnalysisResult staticAnalysis,
        OverallRisk overallRisk) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportFileInfo(
            String originalPath,
            String hash,
            Instant createdAt,
            String eventType,
            String mimeType,
            Long sizeBytes) {
    }

    public record OverallRisk(int score, OverallRiskLevel level) {

        public static OverallRisk of(int score) {
            return new OverallRisk(score, OverallRiskLevel.fromScore(score));
        }
    }

    public static String reportIdFor(String contentHash) {
        return "report-" + contentHash;
    }

    /**
     * Merge a job with its analysis. The score is the analysis root score, or
     * 0 when no analysis is available.
     */
    public static ReportRecord build(JobEntry entry, AnalysisResult analysis, Instant now) {
        String mimeType = entry.fileType();
        Long size = null;
        int score = 0;
        if (analysis != null) {
            if (analysis.fileInfo() != null) {
                if (analysis.fileInfo().mimeType() != null) {
                    mimeType = analysis.fileInfo().mimeType();
                }
                size = analysis.fileInfo().sizeBytes();
            }
            score = analysis.risk().score();
        }
        ReportFileInfo info = new ReportFileInfo(entry.originalPath(), entry.contentHash(), entry.createdAt(),
                entry.eventType(), mimeType, size);
        return new ReportRecord(reportIdFor(entry.contentHash()), now, info, analysis, OverallRisk.of(score));
    }
}
