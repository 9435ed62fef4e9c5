package com.triagesentinel.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Directory intake configuration consumed by the producer side only.
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "sentinel.intake")
@Validated
public class IntakeConfig {

    private String watchDir = System.getProperty("user.home") + "/Downloads";
    private List<String> fileTypes = new ArrayList<>(List.of("*"));
    private boolean recursive = true;
    private List<String> ignoredExtensions = new ArrayList<>(List.of(
            ".crdownload", ".part", ".download", ".inprogress", "._mp", ".partial",
            ".dms", ".bak", ".opdownload", ".!ut", ".bc!", ".xltd", ".filepart",
            ".tmp", ".unfinished", ".aria2"));

    public String getWatchDir() {
        return watchDir;
    }

    public void setWatchDir(String watchDir) {
        this.watchDir = watchDir;
    }

    public List<String> getFileTypes() {
        return fileTypes;
    }

    public void setFileTypes(List<String> fileTypes) {
        this.fileTypes = fileTypes;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public List<String> getIgnoredExtensions() {
        return ignoredExtensions;
    }

    public void setIgnoredExtensions(List<String> ignoredExtensions) {
        this.ignoredExtensions = ignoredExtensions;
    }
}
