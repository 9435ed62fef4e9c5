package com.triagesentinel.analyzer.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Leaf scanning limits.
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "sentinel.scan")
@Validated
public class ScanConfig {

    @Min(1024)
    private int maxScanBytes = 64 * 1024 * 1024;

    public int getMaxScanBytes() {
        return maxScanBytes;
    }

    public void setMaxScanBytes(int maxScanBytes) {
        this.maxScanBytes = maxScanBytes;
    }
}
