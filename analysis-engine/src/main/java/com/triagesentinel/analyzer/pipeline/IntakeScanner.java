package com.triagesentinel.analyzer.pipeline;

import com.triagesentinel.analyzer.config.IntakeConfig;
import com.triagesentinel.analyzer.queue.JobProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Polling producer for a watch directory.
 *
 * <p>
 * Each cycle lists the directory, filters by the allow-list globs and the
 * ignored temporary suffixes, and hands every file whose size or modification
 * time changed since it was last submitted to the {@link JobProducer}. The
 * producer de-duplicates by content hash. Files whose submission failed are
 * retried on the next cycle.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@ConditionalOnProperty(prefix = "sentinel.intake", name = "enabled", havingValue = "true")
public class IntakeScanner {

    private static final Logger log = LoggerFactory.getLogger(IntakeScanner.class);

    private record Seen(long size, long modifiedMillis) {
    }

    private final JobProducer producer;
    private final Path watchDir;
    private final boolean recursive;
    private final List<PathMatcher> allowList;
    private final List<String> ignoredExtensions;
    private final Map<Path, Seen> submitted = new ConcurrentHashMap<>();

    public IntakeScanner(JobProducer producer, IntakeConfig config) {
        this.producer = producer;
        this.watchDir = Path.of(config.getWatchDir()).toAbsolutePath().normalize();
        this.recursive = config.isRecursive();
        this.allowList = config.getFileTypes().stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
        this.ignoredExtensions = config.getIgnoredExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
        log.info("Intake scanner watching {} (recursive={}, types={})", watchDir, recursive,
                config.getFileTypes());
    }

    @Scheduled(fixedDelayString = "${sentinel.pipeline.poll-interval-ms:10000}")
    public void poll() {
        try {
            scanOnce();
        } catch (Exception e) {
            log.error("Intake scan of {} failed: {}", watchDir, e.getMessage(), e);
        }
    }

    /**
     * Submit new or changed files.
     *
     * @return number of files the producer queued
     */
    public int scanOnce() throws IOException {
        if (!Files.isDirectory(watchDir)) {
            log.warn("Watch directory {} does not exist", watchDir);
            return 0;
        }
        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(watchDir, recursive ? Integer.MAX_VALUE : 1)) {
            candidates = walk.filter(Files::isRegularFile).filter(this::accepts).sorted().toList();
        }
        int queued = 0;
        for (Path file : candidates) {
            Seen current;
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                current = new Seen(attrs.size(), attrs.lastModifiedTime().toMillis());
            } catch (IOException e) {
                log.debug("File vanished before it could be queued: {}", file);
                continue;
            }
            if (current.equals(submitted.get(file))) {
                continue;
            }
            JobProducer.Outcome outcome = producer.submit(file);
            if (outcome == JobProducer.Outcome.FAILED) {
                continue;
            }
            if (outcome == JobProducer.Outcome.QUEUED) {
                queued++;
            }
            submitted.put(file, current);
        }
        submitted.keySet().removeIf(p -> !Files.exists(p));
        return queued;
    }

    boolean accepts(Path file) {
        String name = file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        for (String ext : ignoredExtensions) {
            if (lower.endsWith(ext)) {
                return false;
            }
        }
        Path fileName = file.getFileName();
        return allowList.stream().anyMatch(m -> m.matches(fileName));
    }
}
