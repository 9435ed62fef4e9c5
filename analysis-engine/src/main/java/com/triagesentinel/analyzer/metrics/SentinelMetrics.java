package com.triagesentinel.analyzer.metrics;

import com.triagesentinel.analyzer.archive.ArchiveExtractor;
import com.triagesentinel.analyzer.config.ExtractionConfig;
import com.triagesentinel.analyzer.queue.JobEntry;
import com.triagesentinel.analyzer.queue.JobStatus;
import com.triagesentinel.analyzer.queue.QueueStore;
import com.triagesentinel.analyzer.signature.SignatureEngine;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pipeline gauges and periodic maintenance.
 *
 * <p>
 * Registered metrics (in addition to per-component counters/timers):
 * </p>
 * <ul>
 * <li>{@code sentinel.queue.entries{status}} - queue entries per state</li>
 * <li>{@code sentinel.signature.rules} - compiled signature rules</li>
 * <li>{@code sentinel.uptime_seconds} - process uptime</li>
 * </ul>
 *
 * <p>
 * Maintenance refreshes the queue gauges and deletes extraction workspaces a
 * crashed process left in the scratch root.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class SentinelMetrics {

    private static final Logger log = LoggerFactory.getLogger(SentinelMetrics.class);

    private final QueueStore queueStore;
    private final ArchiveExtractor archiveExtractor;
    private final SignatureEngine signatureEngine;
    private final Duration staleWorkspaceAge;
    private final MeterRegistry meterRegistry;

    private final Map<JobStatus, AtomicInteger> entriesByStatus = new EnumMap<>(JobStatus.class);
    private final long startTime = System.currentTimeMillis();

    public SentinelMetrics(
            QueueStore queueStore,
            ArchiveExtractor archiveExtractor,
            SignatureEngine signatureEngine,
            ExtractionConfig extractionConfig,
            MeterRegistry meterRegistry) {
        this.queueStore = queueStore;
        this.archiveExtractor = archiveExtractor;
        this.signatureEngine = signatureEngine;
        this.staleWorkspaceAge = Duration.ofMinutes(extractionConfig.getStaleWorkspaceMinutes());
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        for (JobStatus status : JobStatus.values()) {
            AtomicInteger value = new AtomicInteger();
            entriesByStatus.put(status, value);
            Gauge.builder("sentinel.queue.entries", value, AtomicInteger::get)
                    .description("Queue entries per status at the last maintenance run")
                    .tag("status", status.getWireValue())
                    .register(meterRegistry);
        }

        Gauge.builder("sentinel.signature.rules", signatureEngine, SignatureEngine::ruleCount)
                .description("Compiled signature rules")
                .register(meterRegistry);

        Gauge.builder("sentinel.uptime_seconds", this, m -> (System.currentTimeMillis() - m.startTime) / 1000.0)
                .description("Analysis engine uptime in seconds")
                .register(meterRegistry);

        log.info("Sentinel metrics registered");
    }

    /**
     * Periodic maintenance: refresh queue gauges and prune stale workspaces.
     */
    @Scheduled(fixedRateString = "${sentinel.maintenance.interval-ms:60000}",
            initialDelayString = "${sentinel.maintenance.interval-ms:60000}")
    public void periodicMaintenance() {
        log.debug("Running periodic maintenance");
        try {
            refreshQueueGauges();
            archiveExtractor.pruneStaleWorkspaces(staleWorkspaceAge);
        } catch (Exception e) {
            log.error("Periodic maintenance failed: {}", e.getMessage(), e);
        }
    }

    void refreshQueueGauges() {
        List<JobEntry> entries = queueStore.load();
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobEntry entry : entries) {
            counts.merge(entry.status(), 1, Integer::sum);
        }
        entriesByStatus.forEach((status, gauge) -> gauge.set(counts.getOrDefault(status, 0)));
        int analyzing = counts.getOrDefault(JobStatus.ANALYZING, 0);
        if (analyzing > 0) {
            log.info("{} queue entries currently analyzing", analyzing);
        }
    }

    public int entries(JobStatus status) {
        AtomicInteger value = entriesByStatus.get(status);
        return value == null ? 0 : value.get();
    }
}
