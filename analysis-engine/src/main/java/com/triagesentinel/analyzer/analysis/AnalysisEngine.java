package com.triagesentinel.analyzer.analysis;

import com.triagesentinel.analyzer.archive.ArchiveExtractor;
import com.triagesentinel.analyzer.archive.ArchiveFormat;
import com.triagesentinel.analyzer.archive.ExtractionException;
import com.triagesentinel.analyzer.archive.ExtractionWorkspace;
import com.triagesentinel.analyzer.config.PipelineConfig;
import com.triagesentinel.analyzer.config.ScanConfig;
import com.triagesentinel.analyzer.executable.ExecutableFacts;
import com.triagesentinel.analyzer.executable.PeFormatException;
import com.triagesentinel.analyzer.executable.PeInspector;
import com.triagesentinel.analyzer.indicator.IndicatorExtractor;
import com.triagesentinel.analyzer.signature.SignatureEngine;
import com.triagesentinel.analyzer.signature.SignatureMatch;
import com.triagesentinel.analyzer.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive static analysis of one artifact.
 *
 * <p>
 * The artifact is classified by content into an {@link ArtifactKind}. A
 * container is unpacked through the {@link ArchiveExtractor} and every member
 * is analysed one level deeper; the workspace is deleted when the members are
 * done, whatever the outcome. A leaf runs three independent facets:
 * </p>
 * <ol>
 * <li>signature rules</li>
 * <li>PE inspection, for executables only</li>
 * <li>network indicator extraction</li>
 * </ol>
 *
 * <p>
 * A failing facet leaves its slot empty and never fails the leaf. Extraction
 * failures and depth violations fail only their own node; the parent keeps
 * whatever children were produced.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final ContentSniffer sniffer;
    private final ArchiveExtractor extractor;
    private final SignatureEngine signatureEngine;
    private final PeInspector peInspector;
    private final IndicatorExtractor indicatorExtractor;
    private final int maxDepth;
    private final int maxScanBytes;

    public AnalysisEngine(
            ContentSniffer sniffer,
            ArchiveExtractor extractor,
            SignatureEngine signatureEngine,
            PeInspector peInspector,
            IndicatorExtractor indicatorExtractor,
            PipelineConfig pipelineConfig,
            ScanConfig scanConfig) {
        this.sniffer = sniffer;
        this.extractor = extractor;
        this.signatureEngine = signatureEngine;
        this.peInspector = peInspector;
        this.indicatorExtractor = indicatorExtractor;
        this.maxDepth = pipelineConfig.getMaxDepth();
        this.maxScanBytes = scanConfig.getMaxScanBytes();
    }

    /**
     * Analyse a top-level artifact with the configured depth limit.
     */
    public AnalysisResult analyze(Path file, String hash) {
        return analyze(file, hash, 0, maxDepth);
    }

    /**
     * Analyse an artifact found at {@code depth}.
     *
     * @param file     artifact on disk
     * @param hash     SHA-256 of its bytes
     * @param depth    nesting depth, 0 for a queued file
     * @param maxDepth deepest level that is still opened
     */
    public AnalysisResult analyze(Path file, String hash, int depth, int maxDepth) {
        return analyze(file, file.toString(), hash, depth, maxDepth);
    }

    private AnalysisResult analyze(Path file, String displayPath, String hash, int depth, int maxDepth) {
        long start = System.nanoTime();
        Long size = sizeOf(file);

        if (depth > maxDepth) {
            log.warn("Recursion limit reached at depth {} for {}", depth, displayPath);
            return AnalysisResult.recursionLimit(new FileInfo(hash, displayPath, null, size));
        }

        String mimeType = sniffer.sniff(file);
        FileInfo info = new FileInfo(hash, displayPath, mimeType, size);
        ArtifactKind kind = ArtifactKind.forMimeType(mimeType);

        try {
            if (kind == ArtifactKind.CONTAINER) {
                ArchiveFormat format = kind.archiveFormat(mimeType).orElseThrow();
                return analyzeContainer(file, info, format, depth, maxDepth, start);
            }
            return analyzeLeaf(file, info, kind, size == null ? 0 : size, start);
        } catch (IOException | RuntimeException e) {
            log.error("Analysis failed for {}: {}", displayPath, e.getMessage(), e);
            return AnalysisResult.failed(info, kind, e.getMessage(), elapsedMs(start));
        }
    }

    private AnalysisResult analyzeContainer(Path file, FileInfo info, ArchiveFormat format, int depth,
            int maxDepth, long start) {
        List<AnalysisResult> children = new ArrayList<>();
        FailureKind failure = null;
        String error = null;

        try (ExtractionWorkspace workspace = extractor.extract(file, format)) {
            Path root = workspace.getDirectory();
            for (Path member : workspace.files()) {
                workspace.touch();
                String memberHash = HashUtils.sha256Hex(member);
                String memberName = root.relativize(member).toString().replace('\\', '/');
                children.add(analyze(member, memberName, memberHash, depth + 1, maxDepth));
            }
        } catch (ExtractionException e) {
            failure = FailureKind.EXTRACTION_FAILED;
            error = "Archive processing failed: " + e.getMessage();
            log.warn("Failed to process archive {}: {}", info.path(), e.getMessage());
        } catch (IOException | RuntimeException e) {
            failure = FailureKind.EXTRACTION_FAILED;
            error = "Archive processing failed: " + e.getMessage();
            log.error("Failed to process archive {}: {}", info.path(), e.getMessage(), e);
        }

        AnalysisResult result = AnalysisResult.container(info, children, failure, error, elapsedMs(start));
        log.debug("Container {} ({}) depth={} members={} score={}", info.path(), format, depth,
                children.size(), result.risk().score());
        return result;
    }

    private AnalysisResult analyzeLeaf(Path file, FileInfo info, ArtifactKind kind, long size, long start)
            throws IOException {
        byte[] data = readPrefix(file);

        List<SignatureMatch> matches;
        try {
            matches = signatureEngine.scan(data, data.length);
        } catch (RuntimeException e) {
            log.warn("Signature scan failed for {}: {}", info.path(), e.getMessage());
            matches = List.of();
        }

        ExecutableFacts executable = null;
        if (kind.inspectsExecutable()) {
            try {
                executable = peInspector.inspect(data, data.length, size);
            } catch (PeFormatException e) {
                log.debug("Not a PE file: {} ({})", info.path(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("PE inspection failed for {}: {}", info.path(), e.getMessage());
            }
        }

        Map<String, List<String>> indicators = null;
        try {
            indicators = indicatorExtractor.extract(data, data.length);
        } catch (RuntimeException e) {
            log.warn("Indicator extraction failed for {}: {}", info.path(), e.getMessage());
        }

        AnalysisResult result = AnalysisResult.leaf(info, kind, matches, executable, indicators, elapsedMs(start));
        log.debug("Leaf {} ({}) score={} matches={}", info.path(), info.mimeType(), result.risk().score(),
                matches.size());
        return result;
    }

    private byte[] readPrefix(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return in.readNBytes(maxScanBytes);
        }
    }

    private static Long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return null;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
