package com.triagesentinel.analyzer.pipeline;

import com.triagesentinel.analyzer.analysis.AnalysisEngine;
import com.triagesentinel.analyzer.analysis.AnalysisResult;
import com.triagesentinel.analyzer.config.PipelineConfig;
import com.triagesentinel.analyzer.queue.JobEntry;
import com.triagesentinel.analyzer.queue.JobStatus;
import com.triagesentinel.analyzer.queue.QueueStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Drains pending queue entries through the analysis engine.
 *
 * <p>
 * Per entry:
 * </p>
 * <ol>
 * <li>under the queue lock, flip the first {@code pending} entry to
 * {@code analyzing} and persist; release the lock</li>
 * <li>move the intake copy into the processing area</li>
 * <li>analyse, write {@code <output-dir>/<hash>.json}</li>
 * <li>under the lock again, record {@code analyzed}/{@code failed} and the
 * output path</li>
 * </ol>
 *
 * <p>
 * No analysis work runs while the lock is held. A crash between steps 1 and 4
 * leaves the entry visibly {@code analyzing}; it is never silently re-queued.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@ConditionalOnProperty(prefix = "sentinel.orchestrator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    static final int MAX_JOBS_PER_CYCLE = 1024;

    private final QueueStore queueStore;
    private final AnalysisEngine engine;
    private final AnalysisOutputStore outputStore;
    private final Path intakeDir;
    private final Path processingDir;

    private final Counter analyzedJobs;
    private final Counter failedJobs;
    private final Timer analysisLatency;

    public AnalysisOrchestrator(
            QueueStore queueStore,
            AnalysisEngine engine,
            AnalysisOutputStore outputStore,
            PipelineConfig config,
            MeterRegistry meterRegistry) {
        this.queueStore = queueStore;
        this.engine = engine;
        this.outputStore = outputStore;
        this.intakeDir = config.intakePath();
        this.processingDir = config.processingPath();
        this.analyzedJobs = Counter.builder("sentinel.analysis.jobs")
                .description("Jobs finished by the analysis orchestrator")
                .tag("outcome", "analyzed")
                .register(meterRegistry);
        this.failedJobs = Counter.builder("sentinel.analysis.jobs")
                .description("Jobs finished by the analysis orchestrator")
                .tag("outcome", "failed")
                .register(meterRegistry);
        this.analysisLatency = Timer.builder("sentinel.analysis.latency")
                .description("Wall-clock time to relocate, analyse and persist one job")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${sentinel.pipeline.poll-interval-ms:10000}")
    public void poll() {
        try {
            int processed = pollOnce();
            if (processed > 0) {
                log.info("Analysis cycle finished: {} jobs processed", processed);
            }
        } catch (Exception e) {
            log.error("Analysis cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Process pending entries until none is left or the per-cycle cap is hit.
     *
     * @return number of entries claimed
     */
    public int pollOnce() {
        int processed = 0;
        while (processed < MAX_JOBS_PER_CYCLE) {
            Optional<JobEntry> claimed = queueStore.update(AnalysisOrchestrator::claimNext);
            if (claimed.isEmpty()) {
                break;
            }
            process(claimed.get());
            processed++;
        }
        return processed;
    }

    /** Flip the first entry still {@code pending} to {@code analyzing}. */
    static Optional<JobEntry> claimNext(List<JobEntry> entries) {
        for (int i = 0; i < entries.size(); i++) {
            JobEntry entry = entries.get(i);
            if (entry.status() == JobStatus.PENDING) {
                JobEntry claimed = entry.claim();
                entries.set(i, claimed);
                return Optional.of(claimed);
            }
        }
        return Optional.empty();
    }

    private void process(JobEntry entry) {
        log.info("Analyzing job {} ({})", entry.jobId(), entry.originalPath());
        Timer.Sample sample = Timer.start();
        try {
            Path file = relocate(entry);
            AnalysisResult result = engine.analyze(file, entry.contentHash());
            Path output = outputStore.write(entry.contentHash(), result);
            record(entry, e -> e.complete(result.status(), output.toString(), result.error()));
            (result.isFailed() ? failedJobs : analyzedJobs).increment();
            log.info("Analyzed file: {} (status={}, score={}, output={})", entry.originalPath(),
                    result.status().getWireValue(), result.risk().score(), output);
        } catch (RelocationException e) {
            log.error("Failed to move file to processing for job {}: {}", entry.jobId(), e.getMessage());
            record(entry, x -> x.fail(e.getMessage()));
            failedJobs.increment();
        } catch (Exception e) {
            log.error("Analysis of job {} failed: {}", entry.jobId(), e.getMessage(), e);
            String message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
            record(entry, x -> x.fail(message));
            failedJobs.increment();
        } finally {
            sample.stop(analysisLatency);
        }
    }

    /**
     * Move the intake copy into the processing area. The file name is taken
     * from the entry's shared path; the directory is always the configured
     * intake area.
     */
    Path relocate(JobEntry entry) throws RelocationException {
        if (entry.sharedPath() == null || entry.sharedPath().isEmpty()) {
            throw new RelocationException("Job " + entry.jobId() + " has no shared path");
        }
        Path name = Path.of(entry.sharedPath()).getFileName();
        Path source = intakeDir.resolve(name);
        Path target = processingDir.resolve(name);
        try {
            Files.createDirectories(processingDir);
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Moved file to processing: {}", target);
            return target;
        } catch (IOException e) {
            throw new RelocationException("Failed to move " + source + " to processing: " + e, e);
        }
    }

    private void record(JobEntry claimed, UnaryOperator<JobEntry> transition) {
        boolean updated = queueStore.update(entries -> {
            for (int i = 0; i < entries.size(); i++) {
                JobEntry current = entries.get(i);
                if (current.contentHash().equals(claimed.contentHash()) && current.status() == JobStatus.ANALYZING) {
                    entries.set(i, transition.apply(current));
                    return true;
                }
            }
            return false;
        });
        if (!updated) {
            log.warn("Job {} is no longer analyzing; outcome not recorded", claimed.jobId());
        }
    }
}
