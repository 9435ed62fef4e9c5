package com.triagesentinel.analyzer.archive;

import com.triagesentinel.analyzer.archive.ExtractionException.Reason;
import com.triagesentinel.analyzer.config.ExtractionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * RAR and 7z extraction through external tools ({@code 7z}, {@code unrar}).
 *
 * <p>
 * Tools are tried in order. For each tool the listing command runs first:
 * every member name is validated against the workspace and the declared file
 * count and size are checked against the caps before the extraction command
 * is started. While the tool runs, the workspace is measured every
 * {@code watch-interval-ms} and the tool is killed as soon as the byte budget
 * is exceeded or {@code external-timeout-ms} elapses. A failed attempt empties
 * the workspace before the next tool runs.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@Order(3)
public class ExternalExtractorCodec implements ArchiveCodec {

    private static final Logger log = LoggerFactory.getLogger(ExternalExtractorCodec.class);

    /** Time a killed tool gets to exit before the workspace is touched. */
    private static final long KILL_GRACE_MS = 5_000;

    private final List<ExtractionConfig.ExternalTool> tools;
    private final long timeoutMs;
    private final long watchIntervalMs;

    public ExternalExtractorCodec(ExtractionConfig config) {
        this.tools = List.copyOf(config.getExternalTools());
        this.timeoutMs = config.getExternalTimeoutMs();
        this.watchIntervalMs = config.getWatchIntervalMs();
    }

    @Override
    public Set<ArchiveFormat> formats() {
        return Set.of(ArchiveFormat.RAR, ArchiveFormat.SEVEN_ZIP);
    }

    @Override
    public int declaredMemberCount(Path archive, ArchiveFormat format, ExtractionTarget target)
            throws ExtractionException {
        Attempts attempts = new Attempts();
        for (ExtractionConfig.ExternalTool tool : tools) {
            ArchiveListing listing = inspect(tool, archive, target, attempts);
            if (listing != null) {
                return listing.fileCount();
            }
        }
        throw attempts.failure(format);
    }

    @Override
    public void extract(Path archive, ArchiveFormat format, ExtractionTarget target) throws ExtractionException {
        Attempts attempts = new Attempts();
        for (ExtractionConfig.ExternalTool tool : tools) {
            if (inspect(tool, archive, target, attempts) == null) {
                continue;
            }
            List<String> command = render(tool.getExtract(), archive, target.getRoot());
            if (command.isEmpty()) {
                continue;
            }
            String name = command.get(0);
            try {
                Process process = new ProcessBuilder(command)
                        .redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                        .start();
                Integer exit = awaitBounded(process, name, archive, target);
                if (exit == null) {
                    attempts.timedOut(name + ": timed out after " + timeoutMs + "ms");
                } else if (exit == 0) {
                    log.debug("Extracted {} with {}", archive, name);
                    return;
                } else {
                    attempts.add(name + ": exit " + exit);
                }
            } catch (IOException e) {
                attempts.add(name + ": " + e.getMessage());
                log.debug("External extractor {} unavailable: {}", name, e.getMessage());
            }
            emptyDirectory(target.getRoot());
        }
        throw attempts.failure(format);
    }

    /**
     * Run a tool's listing command and validate what it reports.
     *
     * @return the listing, or null when the tool could not list the container
     * @throws ExtractionException when a member name escapes the workspace or
     *                             the declared totals exceed the caps
     */
    private ArchiveListing inspect(ExtractionConfig.ExternalTool tool, Path archive, ExtractionTarget target,
            Attempts attempts) throws ExtractionException {
        List<String> command = render(tool.getList(), archive, target.getRoot());
        if (command.isEmpty()) {
            return null;
        }
        String name = command.get(0);
        Path output = null;
        try {
            output = Files.createTempFile("sentinel-listing-", ".txt");
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                kill(process, name);
                attempts.timedOut(name + ": listing timed out after " + timeoutMs + "ms");
                return null;
            }
            if (process.exitValue() != 0) {
                attempts.add(name + ": listing exit " + process.exitValue());
                return null;
            }
            ArchiveListing listing = ArchiveListing.parse(
                    new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
            for (ArchiveListing.Member member : listing.members()) {
                target.checkMember(member.name());
            }
            target.checkDeclared(listing.fileCount(), listing.declaredBytes());
            return listing;
        } catch (IOException e) {
            attempts.add(name + ": " + e.getMessage());
            log.debug("External extractor {} unavailable: {}", name, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException(Reason.TIMED_OUT, "Interrupted while listing " + archive, e);
        } finally {
            if (output != null) {
                deleteQuietly(output);
            }
        }
    }

    /**
     * Wait for the tool while watching the workspace size.
     *
     * @return the exit code, or null when the deadline passed
     */
    private Integer awaitBounded(Process process, String name, Path archive, ExtractionTarget target)
            throws ExtractionException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        try {
            while (!process.waitFor(watchIntervalMs, TimeUnit.MILLISECONDS)) {
                if (System.currentTimeMillis() >= deadline) {
                    kill(process, name);
                    log.warn("External extractor {} timed out on {}", name, archive);
                    return null;
                }
                try {
                    target.checkBytesOnDisk();
                } catch (ExtractionException e) {
                    kill(process, name);
                    throw e;
                } catch (IOException e) {
                    log.debug("Could not measure workspace {}: {}", target.getRoot(), e.getMessage());
                }
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            kill(process, name);
            Thread.currentThread().interrupt();
            throw new ExtractionException(Reason.TIMED_OUT, "Interrupted while extracting " + archive, e);
        }
    }

    private static void kill(Process process, String name) {
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("External extractor {} did not exit after being killed", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static List<String> render(String template, Path archive, Path out) {
        List<String> command = new ArrayList<>();
        if (template == null) {
            return command;
        }
        for (String token : template.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            command.add(token.replace("{archive}", archive.toString()).replace("{out}", out.toString()));
        }
        return command;
    }

    private static void emptyDirectory(Path dir) throws ExtractionException {
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                FileSystemUtils.deleteRecursively(child);
            }
        } catch (IOException e) {
            throw new ExtractionException(Reason.WORKSPACE_UNAVAILABLE,
                    "Could not reset workspace " + dir + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete listing output {}: {}", file, e.getMessage());
        }
    }

    /** Failed attempts across tools, reported together when none succeeds. */
    private static final class Attempts {

        private final List<String> messages = new ArrayList<>();
        private boolean timedOut;

        void add(String message) {
            messages.add(message);
        }

        void timedOut(String message) {
            timedOut = true;
            messages.add(message);
        }

        ExtractionException failure(ArchiveFormat format) {
            Reason reason = timedOut ? Reason.TIMED_OUT : Reason.NO_EXTRACTOR;
            return new ExtractionException(reason, "No extractor available for "
                    + format.name().toLowerCase() + " archives " + messages);
        }
    }
}
