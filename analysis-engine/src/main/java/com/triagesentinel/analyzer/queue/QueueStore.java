package com.triagesentinel.analyzer.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.triagesentinel.analyzer.config.PipelineConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Durable job queue persisted as a single JSON array.
 *
 * <p>
 * Every operation runs inside one critical section guarded by an OS advisory
 * lock on {@code queue.json.lock}. File locks are held per JVM, so a
 * per-document {@link ReentrantLock} serialises threads of this process before
 * they contend for the file lock with other processes.
 * </p>
 *
 * <p>
 * Reads self-heal: a missing document is an empty queue, and a malformed one
 * is copied aside as {@code queue.json.corrupt-<millis>} and treated as empty.
 * Writes go to a sibling temporary file that is atomically renamed over the
 * document, so readers never observe a partial save.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class QueueStore {

    private static final Logger log = LoggerFactory.getLogger(QueueStore.class);

    private static final TypeReference<List<JobEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    /** Poll step while another process holds the file lock. */
    private static final long LOCK_RETRY_MS = 50;

    /** In-process guards keyed by lock file, shared by every store instance. */
    private static final ConcurrentMap<Path, ReentrantLock> JVM_LOCKS = new ConcurrentHashMap<>();

    private final Path queueFile;
    private final Path lockFile;
    private final long lockTimeoutMs;
    private final ObjectMapper objectMapper;
    private final Counter recoveredDocuments;

    public QueueStore(PipelineConfig config, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.queueFile = config.queueFilePath().toAbsolutePath().normalize();
        this.lockFile = config.lockFilePath().toAbsolutePath().normalize();
        this.lockTimeoutMs = config.getLockTimeoutMs();
        this.objectMapper = objectMapper;
        this.recoveredDocuments = Counter.builder("sentinel.queue.recovered")
                .description("Malformed queue documents recovered as empty")
                .register(meterRegistry);
    }

    /**
     * Load all entries in document order.
     *
     * @return a mutable copy of the queue
     */
    public List<JobEntry> load() {
        return withLock(this::readDocument);
    }

    /**
     * Replace the whole document.
     *
     * @param entries the complete new queue contents
     */
    public void save(List<JobEntry> entries) {
        withLock(() -> {
            writeDocument(entries);
            return null;
        });
    }

    /**
     * Run one load-mutate-save cycle under the lock. The document is rewritten
     * only when the mutation changed the list.
     *
     * @param mutation receives a mutable list of the current entries
     * @return whatever the mutation returns
     */
    public <T> T update(Function<List<JobEntry>, T> mutation) {
        return withLock(() -> {
            List<JobEntry> before = readDocument();
            List<JobEntry> working = new ArrayList<>(before);
            T result = mutation.apply(working);
            if (!working.equals(before)) {
                writeDocument(working);
            }
            return result;
        });
    }

    public Optional<JobEntry> findByHash(String contentHash) {
        return load().stream()
                .filter(e -> Objects.equals(e.contentHash(), contentHash))
                .findFirst();
    }

    public Path getQueueFile() {
        return queueFile;
    }

    private List<JobEntry> readDocument() throws IOException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(queueFile);
        } catch (NoSuchFileException e) {
            return new ArrayList<>();
        }
        if (raw.length == 0) {
            return new ArrayList<>();
        }
        try {
            List<JobEntry> entries = objectMapper.readValue(raw, ENTRY_LIST);
            if (entries == null) {
                return new ArrayList<>();
            }
            List<JobEntry> clean = new ArrayList<>(entries.size());
            for (JobEntry entry : entries) {
                if (entry != null && entry.contentHash() != null) {
                    clean.add(entry);
                }
            }
            return clean;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            recoveredDocuments.increment();
            log.warn("Invalid queue document {}, treating as empty: {}", queueFile, e.getMessage());
            preserveCorruptCopy();
            return new ArrayList<>();
        }
    }

    private void preserveCorruptCopy() {
        Path aside = queueFile.resolveSibling(queueFile.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.copy(queueFile, aside, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Corrupt queue document preserved at {}", aside);
        } catch (IOException e) {
            log.warn("Could not preserve corrupt queue document {}: {}", queueFile, e.getMessage());
        }
    }

    private void writeDocument(List<JobEntry> entries) throws IOException {
        Path parent = queueFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = queueFile.resolveSibling(queueFile.getFileName() + ".tmp");
        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(entries);
        Files.write(tmp, json, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE, StandardOpenOption.SYNC);
        try {
            Files.move(tmp, queueFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, queueFile, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Queue saved: {} entries", entries.size());
    }

    private <T> T withLock(LockedAction<T> action) {
        ReentrantLock jvmLock = JVM_LOCKS.computeIfAbsent(lockFile, k -> new ReentrantLock());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(lockTimeoutMs);
        try {
            if (!jvmLock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new QueueLockTimeoutException(lockFile, lockTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueLockTimeoutException(lockFile, lockTimeoutMs);
        }
        try {
            Path parent = lockFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                    FileLock ignored = acquire(channel, deadline)) {
                return action.run();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Queue operation failed on " + queueFile, e);
        } finally {
            jvmLock.unlock();
        }
    }

    private FileLock acquire(FileChannel channel, long deadline) throws IOException {
        while (true) {
            FileLock lock = channel.tryLock();
            if (lock != null) {
                return lock;
            }
            if (System.nanoTime() >= deadline) {
                throw new QueueLockTimeoutException(lockFile, lockTimeoutMs);
            }
            try {
                Thread.sleep(LOCK_RETRY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new QueueLockTimeoutException(lockFile, lockTimeoutMs);
            }
        }
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run() throws IOException;
    }
}
