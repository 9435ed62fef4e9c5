package com.triagesentinel.analyzer.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triagesentinel.analyzer.analysis.AnalysisResult;
import com.triagesentinel.analyzer.config.PipelineConfig;
import com.triagesentinel.analyzer.pipeline.AnalysisOutputStore;
import com.triagesentinel.analyzer.queue.JobEntry;
import com.triagesentinel.analyzer.queue.JobStatus;
import com.triagesentinel.analyzer.queue.QueueStore;
import com.triagesentinel.analyzer.util.JsonFiles;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Turns analysed jobs into reports.
 *
 * <p>
 * Every {@code analyzed} entry without a {@code report_path} gets
 * {@code report-<hash>.json} and {@code report-<hash>.md} in the reports
 * directory and moves to {@code reported}. Report files are created only if
 * absent, and the queue entry is advanced only while it is still
 * {@code analyzed} without a report, so repeated runs never produce a second
 * report.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@ConditionalOnProperty(prefix = "sentinel.reporter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReportBuilder {

    private static final Logger log = LoggerFactory.getLogger(ReportBuilder.class);

    private final QueueStore queueStore;
    private final AnalysisOutputStore outputStore;
    private final MarkdownReportRenderer renderer;
    private final ObjectMapper objectMapper;
    private final Path reportsDir;
    private final Clock clock;
    private final Counter generated;

    @Autowired
    public ReportBuilder(QueueStore queueStore, AnalysisOutputStore outputStore, MarkdownReportRenderer renderer,
            ObjectMapper objectMapper, PipelineConfig config, MeterRegistry meterRegistry) {
        this(queueStore, outputStore, renderer, objectMapper, config, meterRegistry, Clock.systemUTC());
    }

    ReportBuilder(QueueStore queueStore, AnalysisOutputStore outputStore, MarkdownReportRenderer renderer,
            ObjectMapper objectMapper, PipelineConfig config, MeterRegistry meterRegistry, Clock clock) {
        this.queueStore = queueStore;
        this.outputStore = outputStore;
        this.renderer = renderer;
        this.objectMapper = objectMapper;
        this.reportsDir = config.reportsPath();
        this.clock = clock;
        this.generated = Counter.builder("sentinel.report.generated")
                .description("Jobs advanced to reported")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${sentinel.pipeline.poll-interval-ms:10000}")
    public void poll() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Report cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Report every eligible entry once.
     *
     * @return number of entries advanced to {@code reported}
     */
    public int pollOnce() {
        List<JobEntry> ready = queueStore.load().stream()
                .filter(ReportBuilder::isReportable)
                .toList();
        int reported = 0;
        for (JobEntry entry : ready) {
            try {
                if (generate(entry)) {
                    reported++;
                }
            } catch (IOException | RuntimeException e) {
                log.error("Report generation failed for job {}: {}", entry.jobId(), e.getMessage(), e);
            }
        }
        return reported;
    }

    static boolean isReportable(JobEntry entry) {
        return entry.status() == JobStatus.ANALYZED && !entry.hasReport();
    }

    public Path jsonPathFor(String contentHash) {
        return reportsDir.resolve(ReportRecord.reportIdFor(contentHash) + ".json");
    }

    public Path markdownPathFor(String contentHash) {
        return reportsDir.resolve(ReportRecord.reportIdFor(contentHash) + ".md");
    }

    private boolean generate(JobEntry entry) throws IOException {
        Path json = jsonPathFor(entry.contentHash());
        Path markdown = markdownPathFor(entry.contentHash());

        AnalysisResult analysis = outputStore.read(entry.staticOutputPath()).orElse(null);
        ReportRecord report = ReportRecord.build(entry, analysis, clock.instant());

        if (!JsonFiles.writeIfAbsent(json,
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report))) {
            log.info("Report {} already exists, reusing it", json.getFileName());
        }
        JsonFiles.writeIfAbsent(markdown, renderer.render(report).getBytes(StandardCharsets.UTF_8));

        boolean advanced = queueStore.update(entries -> {
            for (int i = 0; i < entries.size(); i++) {
                JobEntry current = entries.get(i);
                if (current.contentHash().equals(entry.contentHash()) && isReportable(current)) {
                    entries.set(i, current.reported(json.toString(), markdown.toString()));
                    return true;
                }
            }
            return false;
        });
        if (advanced) {
            generated.increment();
            log.info("Reports generated: {}, {} (overall={} score={})", json.getFileName(),
                    markdown.getFileName(), report.overallRisk().level(), report.overallRisk().score());
        }
        return advanced;
    }
}
