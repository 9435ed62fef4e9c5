package com.triagesentinel.analyzer.queue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One discovered file tracked through the queue document.
 *
 * <p>
 * Entries are immutable; every state change produces a copy through one of
 * the transition methods, which refuse moves outside {@link JobStatus}'s
 * state machine.
 * </p>
 *
 * @param jobId            short identifier, the first 8 hex chars of the hash
 * @param originalPath     where the producer found the file
 * @param sharedPath       the pipeline-owned copy in the intake area
 * @param contentHash      SHA-256 of the file bytes, the de-duplication key
 * @param status           lifecycle state
 * @param createdAt        when the producer queued the file
 * @param eventType        how the file was discovered ({@code created})
 * @param fileType         MIME type sniffed at intake
 * @param staticOutputPath analysis document, once analysis finished
 * @param reportPath       JSON report, once reported
 * @param reportMdPath     Markdown report, once reported
 * @param error            failure cause, only when {@code status = failed}
 *
 * @author Naveed Gung
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobEntry(
        String jobId,
        String originalPath,
        String sharedPath,
        String contentHash,
        JobStatus status,
        Instant createdAt,
        String eventType,
        String fileType,
        String staticOutputPath,
        String reportPath,
        String reportMdPath,
        String error) {

    public static final int JOB_ID_LENGTH = 8;

    public JobEntry {
        if (status == null) {
            status = JobStatus.PENDING;
        }
    }

    /** Factory for a freshly queued entry. */
    public static JobEntry pending(String originalPath, String sharedPath, String contentHash,
            String fileType, Instant createdAt) {
        return new JobEntry(jobIdFor(contentHash), originalPath, sharedPath, contentHash,
                JobStatus.PENDING, createdAt, "created", fileType, null, null, null, null);
    }

    public static String jobIdFor(String contentHash) {
        return contentHash.substring(0, Math.min(JOB_ID_LENGTH, contentHash.length()));
    }

    /** pending -> analyzing. */
    public JobEntry claim() {
        return moveTo(JobStatus.ANALYZING, staticOutputPath, reportPath, reportMdPath, null);
    }

    /** analyzing -> analyzed | failed, recording where the analysis document went. */
    public JobEntry complete(JobStatus outcome, String outputPath, String failure) {
        if (outcome != JobStatus.ANALYZED && outcome != JobStatus.FAILED) {
            throw new IllegalStatusTransitionException(jobId, status, outcome);
        }
        String err = outcome == JobStatus.FAILED ? (failure == null ? "analysis failed" : failure) : null;
        return moveTo(outcome, outputPath, reportPath, reportMdPath, err);
    }

    /** analyzing -> failed without an analysis document. */
    public JobEntry fail(String failure) {
        return complete(JobStatus.FAILED, staticOutputPath, failure);
    }

    /** analyzed -> reported. */
    public JobEntry reported(String jsonPath, String markdownPath) {
        return moveTo(JobStatus.REPORTED, staticOutputPath, jsonPath, markdownPath, null);
    }

    public boolean hasReport() {
        return reportPath != null && !reportPath.isEmpty();
    }

    private JobEntry moveTo(JobStatus next, String outputPath, String jsonReport, String mdReport,
            String err) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStatusTransitionException(jobId, status, next);
        }
        return new JobEntry(jobId, originalPath, sharedPath, contentHash, next, createdAt,
                eventType, fileType, outputPath, jsonReport, mdReport, err);
    }
}
