package com.triagesentinel.analyzer.executable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Structural facts extracted from a PE image.
 *
 * @param suspiciousImports   imported API names on the injection denylist
 * @param highEntropySections sections whose raw data entropy exceeds the
 *                            threshold
 * @param overlayDetected     bytes exist past the furthest section's raw data
 * @param packed              some section declares zero raw size
 *
 * @author Naveed Gung
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExecutableFacts(
        List<String> suspiciousImports,
        List<String> highEntropySections,
        boolean overlayDetected,
        @JsonProperty("is_packed") boolean packed) {

    public ExecutableFacts {
        suspiciousImports = suspiciousImports == null ? List.of() : List.copyOf(suspiciousImports);
        highEntropySections = highEntropySections == null ? List.of() : List.copyOf(highEntropySections);
    }

    /**
     * Whether any fact contributes to the risk score. Overlay alone does not.
     */
    @JsonIgnore
    public boolean hasFlags() {
        return !suspiciousImports.isEmpty() || !highEntropySections.isEmpty() || packed;
    }
}
