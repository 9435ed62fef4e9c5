package com.triagesentinel.analyzer.archive;

import com.triagesentinel.analyzer.archive.ExtractionException.Reason;
import com.triagesentinel.analyzer.config.ExtractionConfig;
import com.triagesentinel.analyzer.config.PipelineConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Archive safety layer: unpacks one container into a fresh, isolated
 * workspace under the scratch root.
 *
 * <p>
 * Safety gates, in order:
 * </p>
 * <ol>
 * <li><b>Isolation:</b> a uniquely named directory created with create-new
 * semantics; a name collision is a hard failure.</li>
 * <li><b>Declared count:</b> metadata member count checked against the cap
 * before anything is written.</li>
 * <li><b>Traversal:</b> every member path validated before it is written.</li>
 * <li><b>Streaming budgets:</b> member count and decompressed bytes counted
 * while writing.</li>
 * <li><b>Observed totals:</b> files and bytes actually on disk recounted
 * after extraction, since some codecs under-report.</li>
 * <li><b>Containment:</b> symbolic links removed and every produced path
 * resolved against the workspace.</li>
 * </ol>
 *
 * <p>
 * Any failure deletes the workspace before the exception reaches the caller.
 * On success the caller owns the returned {@link ExtractionWorkspace}.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class ArchiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    private static final int MAX_BASENAME = 48;

    private final Path scratchRoot;
    private final int maxMembers;
    private final long maxBytes;
    private final Map<ArchiveFormat, ArchiveCodec> codecs = new EnumMap<>(ArchiveFormat.class);
    private final Set<Path> active = ConcurrentHashMap.newKeySet();
    private final MeterRegistry meterRegistry;

    public ArchiveExtractor(List<ArchiveCodec> codecs, PipelineConfig pipelineConfig,
            ExtractionConfig extractionConfig, MeterRegistry meterRegistry) {
        this.scratchRoot = pipelineConfig.scratchPath().toAbsolutePath().normalize();
        this.maxMembers = extractionConfig.getMaxMembers();
        this.maxBytes = extractionConfig.getMaxExtractedBytes();
        this.meterRegistry = meterRegistry;
        for (ArchiveCodec codec : codecs) {
            for (ArchiveFormat format : codec.formats()) {
                this.codecs.putIfAbsent(format, codec);
            }
        }
        log.info("Archive extractor initialized: scratch={} maxMembers={} maxBytes={} formats={}",
                scratchRoot, maxMembers, maxBytes, this.codecs.keySet());
    }

    /**
     * Extract a container into a new workspace.
     *
     * @param container the archive to unpack
     * @param format    the format sniffed from its content
     * @return the populated workspace, owned by the caller
     * @throws ExtractionException on any failure; no workspace is left behind
     */
    public ExtractionWorkspace extract(Path container, ArchiveFormat format) throws ExtractionException {
        ArchiveCodec codec = codecs.get(format);
        if (codec == null) {
            throw rejected(new ExtractionException(Reason.UNSUPPORTED_FORMAT,
                    "No codec registered for " + format));
        }

        Path workDir = allocate(container);
        try {
            ExtractionTarget target = new ExtractionTarget(workDir, maxMembers, maxBytes);

            int declared = codec.declaredMemberCount(container, format, target);
            if (declared > maxMembers) {
                throw new ExtractionException(Reason.COUNT_EXCEEDED,
                        "Too many files in archive (" + declared + ")");
            }

            codec.extract(container, format, target);

            enforceContainment(workDir);
            int observed = countFiles(workDir);
            if (observed > maxMembers) {
                throw new ExtractionException(Reason.COUNT_EXCEEDED,
                        "File count limit exceeded post-extraction (" + observed + ")");
            }
            target.checkBytesOnDisk();

            log.debug("Extracted {} files ({} declared) from {} into {}", observed,
                    declared == ArchiveCodec.UNKNOWN_COUNT ? "?" : declared, container, workDir);
            return new ExtractionWorkspace(workDir, () -> active.remove(workDir));
        } catch (ExtractionException e) {
            release(workDir);
            throw rejected(e);
        } catch (IOException | RuntimeException e) {
            release(workDir);
            throw rejected(new ExtractionException(Reason.BAD_CONTAINER,
                    "Unexpected error unpacking " + container.getFileName() + ": " + e.getMessage(), e));
        }
    }

    /**
     * Delete workspaces a crashed process left behind. Workspaces this
     * process still holds are skipped whatever their age.
     *
     * @return the number of directories removed
     */
    public int pruneStaleWorkspaces(Duration maxAge) {
        if (!Files.isDirectory(scratchRoot)) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        try (Stream<Path> children = Files.list(scratchRoot)) {
            for (Path child : children.collect(Collectors.toList())) {
                if (active.contains(child)) {
                    continue;
                }
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)
                        && Files.getLastModifiedTime(child).toInstant().isBefore(cutoff)) {
                    ExtractionWorkspace.delete(child);
                    removed++;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan scratch root {}: {}", scratchRoot, e.getMessage());
        }
        if (removed > 0) {
            log.info("Pruned {} stale extraction workspaces from {}", removed, scratchRoot);
        }
        return removed;
    }

    public Path getScratchRoot() {
        return scratchRoot;
    }

    private Path allocate(Path container) throws ExtractionException {
        String name = sanitize(container.getFileName().toString()) + "_" + System.currentTimeMillis()
                + "_" + UUID.randomUUID().toString().substring(0, 8);
        try {
            Files.createDirectories(scratchRoot);
            Path workDir = Files.createDirectory(scratchRoot.resolve(name));
            active.add(workDir);
            return workDir;
        } catch (FileAlreadyExistsException e) {
            throw rejected(new ExtractionException(Reason.WORKSPACE_COLLISION,
                    "Extraction directory collision: " + name, e));
        } catch (IOException e) {
            throw rejected(new ExtractionException(Reason.WORKSPACE_UNAVAILABLE,
                    "Failed to create extraction directory under " + scratchRoot + ": " + e.getMessage(), e));
        }
    }

    private void release(Path workDir) {
        try {
            ExtractionWorkspace.delete(workDir);
        } finally {
            active.remove(workDir);
        }
    }

    /** Strip links and confirm every produced path stays inside the workspace. */
    private static void enforceContainment(Path workDir) throws IOException, ExtractionException {
        Path realRoot = workDir.toRealPath();
        List<Path> produced;
        try (Stream<Path> walk = Files.walk(workDir)) {
            produced = walk.collect(Collectors.toList());
        }
        for (Path path : produced) {
            if (Files.isSymbolicLink(path)) {
                log.warn("Removing symbolic link produced by extraction: {}", path);
                Files.delete(path);
                continue;
            }
            if (!path.toRealPath(LinkOption.NOFOLLOW_LINKS).startsWith(realRoot)) {
                throw new ExtractionException(Reason.TRAVERSAL_VIOLATION, "Extracted path escapes workspace: "
                        + path);
            }
        }
    }

    private static int countFiles(Path workDir) throws IOException {
        try (Stream<Path> walk = Files.walk(workDir)) {
            return (int) walk.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)).count();
        }
    }

    static String sanitize(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String clean = base.replaceAll("[^A-Za-z0-9._-]", "_");
        if (clean.isEmpty() || clean.chars().allMatch(c -> c == '.')) {
            clean = "archive";
        }
        return clean.length() > MAX_BASENAME ? clean.substring(0, MAX_BASENAME) : clean;
    }

    private ExtractionException rejected(ExtractionException e) {
        Counter.builder("sentinel.extraction.rejected")
                .description("Archives rejected by the safety layer")
                .tag("reason", e.getReason().getCode())
                .register(meterRegistry)
                .increment();
        log.warn("Failed to unpack archive or security check failed: {}", e.getMessage());
        return e;
    }
}
