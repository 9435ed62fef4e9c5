package com.triagesentinel.analyzer.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.triagesentinel.analyzer.executable.ExecutableFacts;
import com.triagesentinel.analyzer.indicator.IndicatorExtractor;
import com.triagesentinel.analyzer.queue.JobStatus;
import com.triagesentinel.analyzer.signature.SignatureMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of an analysis tree.
 *
 * <p>
 * A container node carries its members in {@code children} and no leaf facets
 * of its own; its {@code signatureMatches} and {@code extractedIndicators} are
 * the concatenation of every child's (which already include their own
 * descendants), and its score is the maximum child score. A leaf node has no
 * children.
 * </p>
 *
 * @param analysisId          {@code static_} plus the first 8 hash characters
 * @param fileInfo            identity of the artifact
 * @param kind                capability tag selected from the sniffed type;
 *                            null when the node was never classified
 * @param signatureMatches    own and descendant rule hits
 * @param executableAnalysis  PE facts, when the artifact parsed as PE
 * @param extractedIndicators {@code urls} / {@code ips} to values
 * @param children            archive members in extraction order
 * @param risk                node score
 * @param status              {@code analyzed} or {@code failed}
 * @param failure             failure kind when failed
 * @param error               failure message when failed
 * @param durationMs          wall-clock time including children
 *
 * @author Naveed Gung
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisResult(
        String analysisId,
        FileInfo fileInfo,
        ArtifactKind kind,
        List<SignatureMatch> signatureMatches,
        ExecutableFacts executableAnalysis,
        Map<String, List<String>> extractedIndicators,
        List<AnalysisResult> children,
        RiskAssessment risk,
        JobStatus status,
        FailureKind failure,
        String error,
        long durationMs) {

    public static final String RECURSION_LIMIT_MESSAGE = "max recursion depth exceeded";

    public AnalysisResult {
        signatureMatches = signatureMatches == null ? List.of() : List.copyOf(signatureMatches);
        extractedIndicators = copy(extractedIndicators == null ? emptyIndicators() : extractedIndicators);
        children = children == null ? List.of() : List.copyOf(children);
        if (risk == null) {
            risk = RiskAssessment.NONE;
        }
        if (status == null) {
            status = JobStatus.ANALYZED;
        }
    }

    public static String analysisIdFor(String hash) {
        return "static_" + hash.substring(0, Math.min(8, hash.length()));
    }

    /** Node for an artifact below the nesting limit. It is never opened. */
    public static AnalysisResult recursionLimit(FileInfo fileInfo) {
        return new AnalysisResult(analysisIdFor(fileInfo.hash()), fileInfo, null, null, null, null, null,
                RiskAssessment.NONE, JobStatus.FAILED, FailureKind.RECURSION_LIMIT_EXCEEDED,
                RECURSION_LIMIT_MESSAGE, 0);
    }

    public static AnalysisResult leaf(FileInfo fileInfo, ArtifactKind kind, List<SignatureMatch> matches,
            ExecutableFacts executable, Map<String, List<String>> indicators, long durationMs) {
        RiskAssessment risk = RiskScorer.scoreLeaf(
                !matches.isEmpty(),
                executable != null && executable.hasFlags(),
                hasIndicators(indicators));
        return new AnalysisResult(analysisIdFor(fileInfo.hash()), fileInfo, kind, matches, executable,
                indicators, null, risk, JobStatus.ANALYZED, null, null, durationMs);
    }

    /**
     * Fold children into a container node. Pass a failure kind and message to
     * mark the container failed while keeping the children already produced.
     */
    public static AnalysisResult container(FileInfo fileInfo, List<AnalysisResult> children,
            FailureKind failure, String error, long durationMs) {
        List<SignatureMatch> matches = new ArrayList<>();
        Map<String, List<String>> indicators = emptyIndicators();
        for (AnalysisResult child : children) {
            matches.addAll(child.signatureMatches());
            child.extractedIndicators().forEach(
                    (key, values) -> indicators.computeIfAbsent(key, k -> new ArrayList<>()).addAll(values));
        }
        return new AnalysisResult(analysisIdFor(fileInfo.hash()), fileInfo, ArtifactKind.CONTAINER, matches,
                null, indicators, children, RiskScorer.scoreContainer(children),
                failure == null ? JobStatus.ANALYZED : JobStatus.FAILED, failure, error, durationMs);
    }

    /** Node for an artifact whose analysis faulted outright. */
    public static AnalysisResult failed(FileInfo fileInfo, ArtifactKind kind, String error, long durationMs) {
        return new AnalysisResult(analysisIdFor(fileInfo.hash()), fileInfo, kind, null, null, null, null,
                RiskAssessment.NONE, JobStatus.FAILED, FailureKind.ANALYSIS_FAILED, error, durationMs);
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == JobStatus.FAILED;
    }

    @JsonIgnore
    public boolean isContainer() {
        return kind == ArtifactKind.CONTAINER;
    }

    /** Number of nodes in this subtree, this one included. */
    public int nodeCount() {
        int n = 1;
        for (AnalysisResult child : children) {
            n += child.nodeCount();
        }
        return n;
    }

    static boolean hasIndicators(Map<String, List<String>> indicators) {
        if (indicators == null) {
            return false;
        }
        for (List<String> values : indicators.values()) {
            if (values != null && !values.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, List<String>> emptyIndicators() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put(IndicatorExtractor.URLS, new ArrayList<>());
        map.put(IndicatorExtractor.IPS, new ArrayList<>());
        return map;
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> indicators) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        indicators.forEach((key, values) -> map.put(key, values == null ? List.of() : List.copyOf(values)));
        return Collections.unmodifiableMap(map);
    }
}
