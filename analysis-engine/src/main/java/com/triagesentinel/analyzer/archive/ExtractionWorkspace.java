package com.triagesentinel.analyzer.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A populated extraction directory owned by the caller.
 *
 * <p>
 * Use with try-with-resources; {@link #close()} deletes the directory and
 * everything in it.
 * </p>
 *
 * @author Naveed Gung
 */
public class ExtractionWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExtractionWorkspace.class);

    private final Path directory;
    private final Runnable onClose;
    private boolean closed;

    ExtractionWorkspace(Path directory, Runnable onClose) {
        this.directory = directory;
        this.onClose = onClose;
    }

    public Path getDirectory() {
        return directory;
    }

    /** Regular files under the workspace, walked recursively, in path order. */
    public List<Path> files() throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    /**
     * Mark the workspace as in use so that stale-workspace pruning in another
     * process leaves it alone.
     */
    public void touch() {
        try {
            Files.setLastModifiedTime(directory, FileTime.from(Instant.now()));
        } catch (IOException e) {
            log.debug("Could not touch extraction directory {}: {}", directory, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            delete(directory);
        } finally {
            onClose.run();
        }
    }

    static void delete(Path directory) {
        try {
            FileSystemUtils.deleteRecursively(directory);
            log.debug("Removed extraction directory: {}", directory);
        } catch (IOException e) {
            log.warn("Failed to remove extraction directory {}: {}", directory, e.getMessage());
        }
    }
}
