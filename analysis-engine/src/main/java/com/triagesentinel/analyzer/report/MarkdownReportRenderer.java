package com.triagesentinel.analyzer.report;

import com.triagesentinel.analyzer.analysis.AnalysisResult;
import com.triagesentinel.analyzer.executable.ExecutableFacts;
import com.triagesentinel.analyzer.signature.SignatureMatch;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Human-readable companion of a {@link ReportRecord}.
 *
 * @author Naveed Gung
 */
@Component
public class MarkdownReportRenderer {

    static final int INDICATOR_LIMIT = 10;

    public String render(ReportRecord report) {
        StringBuilder md = new StringBuilder();
        md.append("# Malware Analysis Report\n\n");
        md.append("**Report ID**: `").append(report.reportId()).append("`  \n");
        md.append("**Generated**: ").append(report.generatedAt()).append("\n\n");
        md.append("---\n\n");

        fileSection(md, report.fileInfo());
        riskSection(md, report.overallRisk());

        AnalysisResult analysis = report.staticAnalysis();
        md.append("## Static Analysis\n\n");
        if (analysis == null) {
            md.append("*No static analysis available.*\n");
            return md.toString();
        }
        md.append("- **Status**: `").append(analysis.status().getWireValue()).append("`\n");
        md.append("- **Risk Score**: `").append(analysis.risk().score()).append("` (")
                .append(analysis.risk().level()).append(", ")
                .append(analysis.risk().recommendation()).append(")\n");
        md.append("- **Duration**: `").append(analysis.durationMs()).append("` ms\n");
        if (analysis.error() != null) {
            md.append("- **Error**: ").append(escape(analysis.error())).append("\n");
        }
        md.append("\n");

        signatureSection(md, analysis.signatureMatches());
        executableSection(md, analysis.executableAnalysis());
        indicatorSection(md, analysis.extractedIndicators());
        memberSection(md, analysis.children());
        return md.toString();
    }

    private void fileSection(StringBuilder md, ReportRecord.ReportFileInfo info) {
        md.append("## File Information\n\n");
        md.append("- **Original Path**: `").append(info.originalPath()).append("`\n");
        md.append("- **SHA256**: `").append(info.hash()).append("`\n");
        md.append("- **Event**: `").append(info.eventType() == null ? "unknown" : info.eventType()).append("`\n");
        md.append("- **Queued**: `").append(info.createdAt() == null ? "N/A" : info.createdAt()).append("`\n");
        if (info.mimeType() != null) {
            md.append("- **File Type**: `").append(info.mimeType()).append("`\n");
        }
        if (info.sizeBytes() != null) {
            md.append("- **Size**: `").append(info.sizeBytes()).append("` bytes\n");
        }
        md.append("\n");
    }

    private void riskSection(StringBuilder md, ReportRecord.OverallRisk risk) {
        OverallRiskLevel level = risk.level();
        md.append("## Overall Risk\n\n");
        md.append("![Risk](https://img.shields.io/badge/Risk-").append(level).append('-')
                .append(level.getBadgeColor()).append("?style=for-the-badge) **Score: ")
                .append(risk.score()).append("**\n\n");
    }

    private void signatureSection(StringBuilder md, List<SignatureMatch> matches) {
        if (matches.isEmpty()) {
            return;
        }
        md.append("### Signature Matches\n\n");
        md.append("| Rule | Severity | Strings | Source |\n");
        md.append("|------|----------|---------|--------|\n");
        for (SignatureMatch match : matches) {
            md.append("| `").append(match.ruleName()).append("` | ")
                    .append(match.severity()).append(" | ")
                    .append(String.join(", ", match.matchedStrings())).append(" | ")
                    .append(escape(match.sourceRule())).append(" |\n");
        }
        md.append("\n");
    }

    private void executableSection(StringBuilder md, ExecutableFacts facts) {
        if (facts == null) {
            return;
        }
        md.append("### Executable Facts\n\n");
        md.append("- **Suspicious Imports**: ").append(listOrNone(facts.suspiciousImports())).append("\n");
        md.append("- **High-Entropy Sections**: ").append(listOrNone(facts.highEntropySections())).append("\n");
        md.append("- **Overlay**: ").append(facts.overlayDetected() ? "yes" : "no").append("\n");
        md.append("- **Packed**: ").append(facts.packed() ? "yes" : "no").append("\n\n");
    }

    private void indicatorSection(StringBuilder md, Map<String, List<String>> indicators) {
        boolean any = indicators.values().stream().anyMatch(v -> !v.isEmpty());
        if (!any) {
            return;
        }
        md.append("### Indicators\n\n");
        indicators.forEach((kind, values) -> {
            if (values.isEmpty()) {
                return;
            }
            md.append("**").append(kind).append("**\n\n```\n");
            values.stream().limit(INDICATOR_LIMIT).forEach(v -> md.append(v).append('\n'));
            if (values.size() > INDICATOR_LIMIT) {
                md.append("... (").append(values.size() - INDICATOR_LIMIT).append(" more)\n");
            }
            md.append("```\n\n");
        });
    }

    private void memberSection(StringBuilder md, List<AnalysisResult> children) {
        if (children.isEmpty()) {
            return;
        }
        md.append("### Archive Members\n\n");
        md.append("| Member | Type | Status | Score | Level |\n");
        md.append("|--------|------|--------|-------|-------|\n");
        for (AnalysisResult child : children) {
            String path = child.fileInfo() == null ? "?" : child.fileInfo().path();
            String type = child.fileInfo() == null || child.fileInfo().mimeType() == null
                    ? "-" : child.fileInfo().mimeType();
            md.append("| `").append(path).append("` | ").append(type).append(" | ")
                    .append(child.status().getWireValue()).append(" | ")
                    .append(child.risk().score()).append(" | ")
                    .append(child.risk().level()).append(" |\n");
        }
        md.append("\n");
    }

    private static String listOrNone(List<String> values) {
        return values.isEmpty() ? "none" : "`" + String.join("`, `", values) + "`";
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("|", "\\|").replace("\n", " ");
    }
}
