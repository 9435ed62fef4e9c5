package com.triagesentinel.analyzer.queue;

import com.triagesentinel.analyzer.TestFixtures;
import com.triagesentinel.analyzer.analysis.ContentSniffer;
import com.triagesentinel.analyzer.config.PipelineConfig;
import com.triagesentinel.analyzer.util.HashUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JobProducerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path root;

    private PipelineConfig config;
    private QueueStore store;
    private SimpleMeterRegistry registry;
    private JobProducer producer;

    @BeforeEach
    void setUp() {
        config = TestFixtures.pipelineConfig(root);
        registry = new SimpleMeterRegistry();
        store = new QueueStore(config, TestFixtures.objectMapper(), registry);
        producer = new JobProducer(store, new ContentSniffer(), config, registry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldQueueNewFileAsPending() throws Exception {
        Path file = write("downloads/invoice.txt", "hello");

        assertTrue(producer.add(file));

        List<JobEntry> entries = store.load();
        assertEquals(1, entries.size());
        JobEntry entry = entries.get(0);
        String hash = HashUtils.sha256Hex("hello".getBytes(StandardCharsets.UTF_8));
        assertEquals(hash, entry.contentHash());
        assertEquals(hash.substring(0, 8), entry.jobId());
        assertEquals(JobStatus.PENDING, entry.status());
        assertEquals(NOW, entry.createdAt());
        assertEquals(ContentSniffer.TEXT_MIME, entry.fileType());
        assertEquals(file.toAbsolutePath().normalize().toString(), entry.originalPath());

        Path copy = Path.of(entry.sharedPath());
        assertEquals(entry.jobId() + "_invoice.txt", copy.getFileName().toString());
        assertEquals("hello", Files.readString(copy));
        assertEquals(1.0, registry.get("sentinel.queue.enqueued").counter().count());
    }

    @Test
    void shouldDeduplicateIdenticalContent() throws Exception {
        Path first = write("downloads/a.bin", "same bytes");
        Path second = write("elsewhere/b.bin", "same bytes");

        assertTrue(producer.add(first));
        assertFalse(producer.add(second));
        assertFalse(producer.add(first));

        assertEquals(1, store.load().size());
        try (var intake = Files.list(config.intakePath())) {
            assertEquals(1, intake.count());
        }
        assertEquals(2.0, registry.get("sentinel.queue.duplicates").counter().count());
    }

    @Test
    void shouldDeduplicateAgainstEntriesInAnyState() throws Exception {
        Path file = write("downloads/a.bin", "payload");
        producer.add(file);
        store.update(entries -> entries.set(0, entries.get(0).claim()));

        assertFalse(producer.add(file));
        assertEquals(1, store.load().size());
    }

    @Test
    void shouldRejectMissingFilesAndDirectories() throws Exception {
        assertFalse(producer.add(root.resolve("nope.txt")));
        Files.createDirectories(root.resolve("dir"));
        assertFalse(producer.add(root.resolve("dir")));
        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldRemovePendingEntryAndIntakeCopy() throws Exception {
        Path file = write("downloads/a.bin", "payload");
        producer.add(file);
        Path copy = Path.of(store.load().get(0).sharedPath());

        assertTrue(producer.remove(file));

        assertTrue(store.load().isEmpty());
        assertFalse(Files.exists(copy));
    }

    @Test
    void shouldNotRemoveClaimedEntry() throws Exception {
        Path file = write("downloads/a.bin", "payload");
        producer.add(file);
        store.update(entries -> entries.set(0, entries.get(0).claim()));

        assertFalse(producer.remove(file));

        assertEquals(JobStatus.ANALYZING, store.load().get(0).status());
    }

    @Test
    void shouldReportSubmissionOutcomes() throws Exception {
        Path file = write("downloads/a.bin", "payload");

        assertEquals(JobProducer.Outcome.QUEUED, producer.submit(file));
        assertEquals(JobProducer.Outcome.DUPLICATE, producer.submit(file));
        assertEquals(JobProducer.Outcome.REJECTED, producer.submit(root.resolve("missing.bin")));
    }

    @Test
    void shouldFailSubmissionWhenIntakeIsUnavailable() throws Exception {
        Path file = write("downloads/a.bin", "payload");
        Files.createDirectories(config.intakePath().getParent());
        Files.writeString(config.intakePath(), "blocker");

        assertEquals(JobProducer.Outcome.FAILED, producer.submit(file));
        assertTrue(store.load().isEmpty());

        Files.delete(config.intakePath());
        assertEquals(JobProducer.Outcome.QUEUED, producer.submit(file));
    }

    @Test
    void shouldCopyIntoIntakeBeforeTakingQueueLock() throws Exception {
        List<String> stagedAtLock = new ArrayList<>();
        QueueStore observing = new QueueStore(config, TestFixtures.objectMapper(), registry) {
            @Override
            public <T> T update(Function<List<JobEntry>, T> mutation) {
                try (Stream<Path> intake = Files.list(config.intakePath())) {
                    intake.filter(p -> p.getFileName().toString().endsWith(".part"))
                            .forEach(p -> stagedAtLock.add(readQuietly(p)));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return super.update(mutation);
            }
        };
        JobProducer staging = new JobProducer(observing, new ContentSniffer(), config, registry,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertTrue(staging.add(write("downloads/big.bin", "large download")));

        assertEquals(List.of("large download"), stagedAtLock);
        try (Stream<Path> intake = Files.list(config.intakePath())) {
            List<String> names = intake.map(p -> p.getFileName().toString()).toList();
            assertEquals(1, names.size());
            assertTrue(names.get(0).endsWith("_big.bin"));
        }
    }

    @Test
    void shouldDiscardStagedCopyWhenDuplicateIsQueuedMeanwhile() throws Exception {
        Path file = write("downloads/a.bin", "payload");
        QueueStore racing = new QueueStore(config, TestFixtures.objectMapper(), registry) {
            @Override
            public Optional<JobEntry> findByHash(String contentHash) {
                return Optional.empty();
            }
        };
        JobProducer late = new JobProducer(racing, new ContentSniffer(), config, registry,
                Clock.fixed(NOW, ZoneOffset.UTC));
        assertTrue(producer.add(file));

        assertEquals(JobProducer.Outcome.DUPLICATE, late.submit(file));

        assertEquals(1, store.load().size());
        try (Stream<Path> intake = Files.list(config.intakePath())) {
            assertEquals(1, intake.count());
        }
    }

    private static String readQuietly(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Path write(String relative, String content) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
