package com.triagesentinel.analyzer.report;

import com.triagesentinel.analyzer.analysis.AnalysisResult;
import com.triagesentinel.analyzer.analysis.ArtifactKind;
import com.triagesentinel.analyzer.analysis.FileInfo;
import com.triagesentinel.analyzer.queue.JobEntry;
import com.triagesentinel.analyzer.queue.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownReportRendererTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:30:00Z");

    private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();

    @Test
    void shouldRenderFileInformationAndBadge() {
        ReportRecord report = ReportRecord.build(entry(), null, NOW);

        String md = renderer.render(report);

        assertTrue(md.startsWith("# Malware Analysis Report\n"));
        assertTrue(md.contains("**Report ID**: `report-" + "a".repeat(64) + "`"));
        assertTrue(md.contains("- **Original Path**: `/downloads/sample.bin`"));
        assertTrue(md.contains("- **Event**: `created`"));
        assertTrue(md.contains("https://img.shields.io/badge/Risk-INFO-blue?style=for-the-badge) **Score: 0**"));
        assertTrue(md.contains("*No static analysis available.*"));
    }

    @Test
    void shouldTruncateLongIndicatorLists() {
        List<String> ips = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            ips.add("8.8.8." + i);
        }
        AnalysisResult leaf = AnalysisResult.leaf(info("sample.bin"), ArtifactKind.GENERIC, List.of(), null,
                Map.of("urls", List.of(), "ips", ips), 1);

        String md = renderer.render(ReportRecord.build(entry(), leaf, NOW));

        assertTrue(md.contains("### Indicators"));
        assertTrue(md.contains("8.8.8.10\n"));
        assertFalse(md.contains("8.8.8.11\n"));
        assertTrue(md.contains("... (2 more)"));
        assertFalse(md.contains("**urls**"));
    }

    @Test
    void shouldListArchiveMembers() {
        AnalysisResult child = AnalysisResult.leaf(info("inner/readme.txt"), ArtifactKind.GENERIC, List.of(),
                null, Map.of("urls", List.of("http://x.example"), "ips", List.of()), 1);
        AnalysisResult limit = AnalysisResult.recursionLimit(info("deep.zip"));
        AnalysisResult container = AnalysisResult.container(info("bundle.zip"), List.of(child, limit), null,
                null, 5);

        String md = renderer.render(ReportRecord.build(entry(), container, NOW));

        assertTrue(md.contains("### Archive Members"));
        assertTrue(md.contains("| `inner/readme.txt` | text/plain | analyzed | 15 | LOW |"));
        assertTrue(md.contains("| `deep.zip` | text/plain | failed | 0 | LOW |"));
        assertTrue(md.contains("- **Risk Score**: `15` (LOW, MONITOR)"));
    }

    private static JobEntry entry() {
        return JobEntry.pending("/downloads/sample.bin", "/intake/aaaaaaaa_sample.bin", "a".repeat(64),
                "application/octet-stream", NOW).claim().complete(JobStatus.ANALYZED, "/out/x.json",
                null);
    }

    private static FileInfo info(String path) {
        return new FileInfo("a".repeat(64), path, "text/plain", 10L);
    }
}
