package com.triagesentinel.analyzer.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.triagesentinel.analyzer.TestFixtures;
import com.triagesentinel.analyzer.config.PipelineConfig;
import com.triagesentinel.analyzer.queue.JobStatus;
import com.triagesentinel.analyzer.signature.SignatureMatch;
import com.triagesentinel.analyzer.util.HashUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisEngineTest {

    @TempDir
    Path root;

    private PipelineConfig config;
    private AnalysisEngine engine;

    @BeforeEach
    void setUp() {
        config = TestFixtures.pipelineConfig(root);
        engine = TestFixtures.analysisEngine(config, TestFixtures.signatureEngine(TestFixtures.MARKER_RULE),
                new SimpleMeterRegistry());
    }

    @Test
    void shouldScoreTextWithPublicAddressAsLow() throws Exception {
        AnalysisResult result = analyze("notes.txt", TestFixtures.text("beacon to 8.8.8.8 and 10.0.0.1"));

        assertEquals(ArtifactKind.GENERIC, result.kind());
        assertEquals(JobStatus.ANALYZED, result.status());
        assertEquals(List.of("8.8.8.8"), result.extractedIndicators().get("ips"));
        assertEquals(List.of(), result.extractedIndicators().get("urls"));
        assertTrue(result.signatureMatches().isEmpty());
        assertNull(result.executableAnalysis());
        assertEquals(15, result.risk().score());
        assertEquals(RiskLevel.LOW, result.risk().level());
        assertEquals(RiskLevel.Recommendation.MONITOR, result.risk().recommendation());
    }

    @Test
    void shouldScoreSuspiciousExecutableAsHigh() throws Exception {
        AnalysisResult result = analyze("dropper.exe", TestFixtures.suspiciousPe());

        assertEquals(ArtifactKind.EXECUTABLE, result.kind());
        assertEquals(ContentSniffer.PE_MIME, result.fileInfo().mimeType());
        assertEquals(1, result.signatureMatches().size());
        SignatureMatch match = result.signatureMatches().get(0);
        assertEquals("Trojan_Marker", match.ruleName());
        assertEquals(List.of("$marker"), match.matchedStrings());
        assertEquals(SignatureMatch.Severity.MEDIUM, match.severity());

        assertNotNull(result.executableAnalysis());
        assertEquals(List.of("VirtualAllocEx"), result.executableAnalysis().suspiciousImports());
        assertTrue(result.executableAnalysis().highEntropySections().contains(".rsrc"));
        assertFalse(result.executableAnalysis().packed());
        assertFalse(result.executableAnalysis().overlayDetected());

        assertEquals(85, result.risk().score());
        assertEquals(RiskLevel.HIGH, result.risk().level());
        assertEquals(RiskLevel.Recommendation.QUARANTINE, result.risk().recommendation());
    }

    @Test
    void shouldTakeMaximumChildScoreForContainer() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("clean.txt", TestFixtures.text("nothing to see here"));
        members.put("payload.exe", TestFixtures.suspiciousPe());
        AnalysisResult result = analyze("bundle.zip", TestFixtures.zip(members));

        assertTrue(result.isContainer());
        assertEquals(JobStatus.ANALYZED, result.status());
        assertNull(result.executableAnalysis());
        assertEquals(2, result.children().size());
        assertEquals("clean.txt", result.children().get(0).fileInfo().path());
        assertEquals(0, result.children().get(0).risk().score());
        assertEquals("payload.exe", result.children().get(1).fileInfo().path());
        assertEquals(85, result.children().get(1).risk().score());

        assertEquals(85, result.risk().score());
        assertEquals(RiskLevel.HIGH, result.risk().level());
        assertEquals(result.children().get(1).signatureMatches(), result.signatureMatches());
    }

    @Test
    void shouldHashMembersIndividually() throws Exception {
        byte[] inner = TestFixtures.text("member bytes");
        AnalysisResult result = analyze("one.zip", TestFixtures.zip(Map.of("m.txt", inner)));

        AnalysisResult child = result.children().get(0);
        assertEquals(HashUtils.sha256Hex(inner), child.fileInfo().hash());
        assertEquals("static_" + child.fileInfo().hash().substring(0, 8), child.analysisId());
        assertEquals(Long.valueOf(inner.length), child.fileInfo().sizeBytes());
    }

    @Test
    void shouldAggregateIndicatorsFromMembers() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("a.txt", TestFixtures.text("fetch http://evil.example/stage2 now"));
        members.put("b.txt", TestFixtures.text("fallback 1.1.1.1"));
        AnalysisResult result = analyze("iocs.zip", TestFixtures.zip(members));

        assertEquals(List.of("http://evil.example/stage2"), result.extractedIndicators().get("urls"));
        assertEquals(List.of("1.1.1.1"), result.extractedIndicators().get("ips"));
        assertEquals(15, result.risk().score());
    }

    @Test
    void shouldStopAtRecursionLimit() throws Exception {
        byte[] archive = TestFixtures.zip(Map.of("deep.txt", TestFixtures.text("EVIL_MARKER at the bottom")));
        for (int level = 4; level >= 1; level--) {
            archive = TestFixtures.zip(Map.of("level" + level + ".zip", archive));
        }
        AnalysisResult result = analyze("nested.zip", archive);

        AnalysisResult node = result;
        for (int depth = 0; depth <= 3; depth++) {
            assertTrue(node.isContainer(), "depth " + depth);
            assertEquals(JobStatus.ANALYZED, node.status(), "depth " + depth);
            assertEquals(1, node.children().size(), "depth " + depth);
            node = node.children().get(0);
        }
        assertEquals(FailureKind.RECURSION_LIMIT_EXCEEDED, node.failure());
        assertEquals(JobStatus.FAILED, node.status());
        assertEquals(AnalysisResult.RECURSION_LIMIT_MESSAGE, node.error());
        assertNull(node.kind());
        assertTrue(node.children().isEmpty());

        assertEquals(5, result.nodeCount());
        assertEquals(0, result.risk().score());
        assertTrue(result.signatureMatches().isEmpty());
    }

    @Test
    void shouldHonourExplicitDepthArguments() throws Exception {
        Path file = write("x.txt", TestFixtures.text("hello"));

        AnalysisResult limited = engine.analyze(file, HashUtils.sha256Hex(file), 2, 1);

        assertEquals(FailureKind.RECURSION_LIMIT_EXCEEDED, limited.failure());
        assertEquals(0, limited.risk().score());
    }

    @Test
    void shouldIsolateBrokenNestedArchive() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("bad.zip", new byte[] {'P', 'K', 3, 4, 9, 9, 9, 9});
        members.put("good.txt", TestFixtures.text("see https://c2.example.net/x"));
        AnalysisResult result = analyze("mixed.zip", TestFixtures.zip(members));

        assertEquals(JobStatus.ANALYZED, result.status());
        assertEquals(2, result.children().size());
        AnalysisResult bad = result.children().get(0);
        assertEquals(FailureKind.EXTRACTION_FAILED, bad.failure());
        assertEquals(JobStatus.FAILED, bad.status());
        assertTrue(bad.error().startsWith("Archive processing failed:"));
        assertEquals(15, result.risk().score());
    }

    @Test
    void shouldFailContainerRejectedBySafetyLayer() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("ok.txt", TestFixtures.text("fine"));
        members.put("../../escape.txt", TestFixtures.text("nope"));
        AnalysisResult result = analyze("slip.zip", TestFixtures.zip(members));

        assertEquals(JobStatus.FAILED, result.status());
        assertEquals(FailureKind.EXTRACTION_FAILED, result.failure());
        assertTrue(result.error().contains("traversal-violation"));
        assertTrue(result.children().isEmpty());
        assertFalse(Files.exists(root.resolve("escape.txt")));
        try (Stream<Path> left = Files.list(root.resolve("scratch"))) {
            assertEquals(0, left.count());
        }
    }

    @Test
    void shouldReportUnreadableFileAsFailedNode() {
        AnalysisResult result = engine.analyze(root.resolve("missing.bin"), "ab".repeat(32));

        assertEquals(JobStatus.FAILED, result.status());
        assertEquals(FailureKind.ANALYSIS_FAILED, result.failure());
        assertEquals(0, result.risk().score());
        assertEquals("static_abababab", result.analysisId());
    }

    @Test
    void shouldSerializeSnakeCaseDocument() throws Exception {
        AnalysisResult result = analyze("dropper.exe", TestFixtures.suspiciousPe());
        ObjectMapper mapper = TestFixtures.objectMapper();

        JsonNode json = mapper.readTree(mapper.writeValueAsBytes(result));

        assertTrue(json.has("analysis_id"));
        assertEquals("analyzed", json.get("status").asText());
        assertEquals("EXECUTABLE", json.get("kind").asText());
        assertEquals(85, json.get("risk").get("score").asInt());
        assertEquals("QUARANTINE", json.get("risk").get("recommendation").asText());
        assertEquals("MEDIUM", json.get("signature_matches").get(0).get("severity").asText());
        assertTrue(json.get("executable_analysis").has("is_packed"));
        assertTrue(json.get("extracted_indicators").has("urls"));
        assertFalse(json.has("failure"));
        assertFalse(json.has("failed"));

        AnalysisResult back = mapper.readValue(mapper.writeValueAsBytes(result), AnalysisResult.class);
        assertEquals(result.risk(), back.risk());
        assertEquals(result.signatureMatches(), back.signatureMatches());
    }

    private AnalysisResult analyze(String name, byte[] content) throws Exception {
        Path file = write(name, content);
        return engine.analyze(file, HashUtils.sha256Hex(file));
    }

    private Path write(String name, byte[] content) throws Exception {
        Path file = root.resolve("processing").resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, content);
        return file;
    }
}
