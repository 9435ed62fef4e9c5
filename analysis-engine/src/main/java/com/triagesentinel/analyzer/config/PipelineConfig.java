package com.triagesentinel.analyzer.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Locations and cadence shared by every pipeline process.
 *
 * <pre>
 * {root}/
 *   queue/queue.json        - job document
 *   queue/queue.json.lock   - advisory lock guarding it
 *   queue/files/            - intake area written by the producer
 *   processed/              - files claimed by the analyzer
 *   static-output/          - one analysis document per content hash
 *   reports/                - JSON and Markdown reports
 *   scratch/                - archive extraction workspaces
 *   rules/                  - signature rule files
 * </pre>
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "sentinel.pipeline")
@Validated
public class PipelineConfig {

    @NotBlank
    private String queueFile = "/analysis/queue/queue.json";
    @NotBlank
    private String intakeDir = "/analysis/queue/files";
    @NotBlank
    private String processingDir = "/analysis/processed";
    @NotBlank
    private String outputDir = "/analysis/static-output";
    @NotBlank
    private String reportsDir = "/analysis/reports";
    @NotBlank
    private String scratchDir = "/analysis/scratch";
    @NotBlank
    private String rulesDir = "/analysis/rules";
    @Min(100)
    private long pollIntervalMs = 10_000;
    @Min(100)
    private long lockTimeoutMs = 30_000;
    @Min(0)
    @Max(16)
    private int maxDepth = 3;

    public String getQueueFile() {
        return queueFile;
    }

    public void setQueueFile(String queueFile) {
        this.queueFile = queueFile;
    }

    public String getIntakeDir() {
        return intakeDir;
    }

    public void setIntakeDir(String intakeDir) {
        this.intakeDir = intakeDir;
    }

    public String getProcessingDir() {
        return processingDir;
    }

    public void setProcessingDir(String processingDir) {
        this.processingDir = processingDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getReportsDir() {
        return reportsDir;
    }

    public void setReportsDir(String reportsDir) {
        this.reportsDir = reportsDir;
    }

    public String getScratchDir() {
        return scratchDir;
    }

    public void setScratchDir(String scratchDir) {
        this.scratchDir = scratchDir;
    }

    public String getRulesDir() {
        return rulesDir;
    }

    public void setRulesDir(String rulesDir) {
        this.rulesDir = rulesDir;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public void setLockTimeoutMs(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public Path queueFilePath() {
        return Path.of(queueFile);
    }

    /** The advisory lock file sits next to the queue document. */
    public Path lockFilePath() {
        return Path.of(queueFile + ".lock");
    }

    public Path intakePath() {
        return Path.of(intakeDir);
    }

    public Path processingPath() {
        return Path.of(processingDir);
    }

    public Path outputPath() {
        return Path.of(outputDir);
    }

    public Path reportsPath() {
        return Path.of(reportsDir);
    }

    public Path scratchPath() {
        return Path.of(scratchDir);
    }

    public Path rulesPath() {
        return Path.of(rulesDir);
    }
}
