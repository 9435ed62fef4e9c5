package com.triagesentinel.analyzer.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource bounds for archive extraction.
 *
 * <p>
 * Each external tool pairs a listing command with an extraction command.
 * Templates are split on whitespace; {@code {archive}} and {@code {out}} are
 * substituted with the container path and the workspace directory. Tools are
 * tried in order until one lists and extracts the container.
 * </p>
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "sentinel.extraction")
@Validated
public class ExtractionConfig {

    @Min(1)
    private int maxMembers = 100;
    @Min(1)
    private long maxExtractedBytes = 512L * 1024 * 1024;
    @Min(100)
    private long externalTimeoutMs = 60_000;
    @Min(1)
    private long staleWorkspaceMinutes = 60;
    @Min(10)
    private long watchIntervalMs = 250;
    private List<ExternalTool> externalTools = new ArrayList<>(List.of(
            new ExternalTool("7z l -slt {archive}", "7z x -y -o{out} {archive}"),
            new ExternalTool("unrar lt {archive}", "unrar x -o+ {archive} {out}/")));

    /** One external extractor: how to list a container and how to unpack it. */
    public static class ExternalTool {

        private String list;
        private String extract;

        public ExternalTool() {
        }

        public ExternalTool(String list, String extract) {
            this.list = list;
            this.extract = extract;
        }

        public String getList() {
            return list;
        }

        public void setList(String list) {
            this.list = list;
        }

        public String getExtract() {
            return extract;
        }

        public void setExtract(String extract) {
            this.extract = extract;
        }
    }

    public int getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(int maxMembers) {
        this.maxMembers = maxMembers;
    }

    public long getMaxExtractedBytes() {
        return maxExtractedBytes;
    }

    public void setMaxExtractedBytes(long maxExtractedBytes) {
        this.maxExtractedBytes = maxExtractedBytes;
    }

    public long getExternalTimeoutMs() {
        return externalTimeoutMs;
    }

    public void setExternalTimeoutMs(long externalTimeoutMs) {
        this.externalTimeoutMs = externalTimeoutMs;
    }

    public long getStaleWorkspaceMinutes() {
        return staleWorkspaceMinutes;
    }

    public void setStaleWorkspaceMinutes(long staleWorkspaceMinutes) {
        this.staleWorkspaceMinutes = staleWorkspaceMinutes;
    }

    public long getWatchIntervalMs() {
        return watchIntervalMs;
    }

    public void setWatchIntervalMs(long watchIntervalMs) {
        this.watchIntervalMs = watchIntervalMs;
    }

    public List<ExternalTool> getExternalTools() {
        return externalTools;
    }

    public void setExternalTools(List<ExternalTool> externalTools) {
        this.externalTools = externalTools;
    }
}
