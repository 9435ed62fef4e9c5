package com.triagesentinel.analyzer.queue;

import com.triagesentinel.analyzer.analysis.ContentSniffer;
import com.triagesentinel.analyzer.config.PipelineConfig;
import com.triagesentinel.analyzer.util.HashUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Producer side of the queue: copies discovered files into the intake area
 * and appends {@code pending} entries.
 *
 * <p>
 * De-duplication is by content hash and happens inside the same locked cycle
 * that appends the entry, so two producers racing on identical bytes still
 * yield a single job. Copying happens outside the lock.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class JobProducer {

    private static final Logger log = LoggerFactory.getLogger(JobProducer.class);

    private final QueueStore queueStore;
    private final ContentSniffer sniffer;
    private final Path intakeDir;
    private final Clock clock;
    private final Counter enqueued;
    private final Counter duplicates;

    @Autowired
    public JobProducer(QueueStore queueStore, ContentSniffer sniffer, PipelineConfig config,
            MeterRegistry meterRegistry) {
        this(queueStore, sniffer, config, meterRegistry, Clock.systemUTC());
    }

    JobProducer(QueueStore queueStore, ContentSniffer sniffer, PipelineConfig config,
            MeterRegistry meterRegistry, Clock clock) {
        this.queueStore = queueStore;
        this.sniffer = sniffer;
        this.intakeDir = config.intakePath().toAbsolutePath().normalize();
        this.clock = clock;
        this.enqueued = Counter.builder("sentinel.queue.enqueued")
                .description("Files accepted into the queue")
                .register(meterRegistry);
        this.duplicates = Counter.builder("sentinel.queue.duplicates")
                .description("Files skipped because their content hash was already queued")
                .register(meterRegistry);
    }

    /** Result of one submission. */
    public enum Outcome {
        /** A new pending entry was appended. */
        QUEUED,
        /** An entry with the same content hash already exists. */
        DUPLICATE,
        /** Not a regular file. */
        REJECTED,
        /** Hashing, copying or the queue lock failed; the file may be submitted again. */
        FAILED
    }

    /**
     * Queue a file for analysis.
     *
     * @param file the discovered file
     * @return true if a new entry was appended, false otherwise
     */
    public boolean add(Path file) {
        return submit(file) == Outcome.QUEUED;
    }

    /**
     * Queue a file for analysis.
     *
     * <p>
     * The intake copy is staged next to its final name before the queue lock
     * is taken; the locked cycle only checks for duplicates, renames the staged
     * copy into place and appends the entry.
     * </p>
     *
     * @param file the discovered file
     * @return what happened to the submission
     */
    public Outcome submit(Path file) {
        Path source = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(source)) {
            log.debug("File does not exist or is not a regular file: {}", source);
            return Outcome.REJECTED;
        }

        Path staged = null;
        try {
            String hash = HashUtils.sha256Hex(source);
            if (queueStore.findByHash(hash).isPresent()) {
                return duplicate(source);
            }
            String fileType = sniffer.sniff(source);
            String jobId = JobEntry.jobIdFor(hash);
            Path dest = intakeDir.resolve(jobId + "_" + source.getFileName());
            staged = stage(source, jobId);

            Path copy = staged;
            boolean added = queueStore.update(entries -> {
                if (entries.stream().anyMatch(e -> hash.equals(e.contentHash()))) {
                    return false;
                }
                moveIntoPlace(copy, dest);
                entries.add(JobEntry.pending(source.toString(), dest.toString(), hash, fileType,
                        Instant.now(clock)));
                return true;
            });

            if (!added) {
                return duplicate(source);
            }
            enqueued.increment();
            log.info("Queued file: {} (SHA256: {})", source, hash);
            return Outcome.QUEUED;
        } catch (IOException | UncheckedIOException | QueueLockTimeoutException e) {
            log.error("Failed to add file {} to queue: {}", source, e.getMessage());
            return Outcome.FAILED;
        } finally {
            if (staged != null) {
                deleteQuietly(staged);
            }
        }
    }

    /**
     * Withdraw a file that has not been claimed yet. Entries already past
     * {@code pending} are left alone.
     *
     * @param originalPath the path the file was queued from
     * @return true if an entry was removed
     */
    public boolean remove(Path originalPath) {
        String target = originalPath.toAbsolutePath().normalize().toString();
        try {
            List<JobEntry> removed = new ArrayList<>();
            queueStore.update(entries -> {
                Iterator<JobEntry> it = entries.iterator();
                while (it.hasNext()) {
                    JobEntry entry = it.next();
                    if (target.equals(entry.originalPath()) && entry.status() == JobStatus.PENDING) {
                        it.remove();
                        removed.add(entry);
                    }
                }
                return null;
            });
            for (JobEntry entry : removed) {
                deleteIntakeCopy(entry);
                log.info("Removed file from queue: {} (job {})", target, entry.jobId());
            }
            if (removed.isEmpty()) {
                log.debug("No pending queue entry for {}", target);
            }
            return !removed.isEmpty();
        } catch (UncheckedIOException | QueueLockTimeoutException e) {
            log.error("Failed to remove file {} from queue: {}", target, e.getMessage());
            return false;
        }
    }

    private Outcome duplicate(Path source) {
        duplicates.increment();
        log.debug("Skipping duplicate file by SHA256: {}", source);
        return Outcome.DUPLICATE;
    }

    private Path stage(Path source, String jobId) throws IOException {
        Files.createDirectories(intakeDir);
        Path staged = Files.createTempFile(intakeDir, "." + jobId + "_", ".part");
        Files.copy(source, staged, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return staged;
    }

    private void moveIntoPlace(Path staged, Path dest) {
        try {
            Files.move(staged, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to move " + staged + " into intake", e);
        }
    }

    private void deleteQuietly(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("Could not delete staged intake copy {}: {}", staged, e.getMessage());
        }
    }

    private void deleteIntakeCopy(JobEntry entry) {
        if (entry.sharedPath() == null) {
            return;
        }
        Path copy = intakeDir.resolve(Path.of(entry.sharedPath()).getFileName());
        try {
            Files.deleteIfExists(copy);
        } catch (IOException e) {
            log.warn("Could not delete intake copy {}: {}", copy, e.getMessage());
        }
    }
}
