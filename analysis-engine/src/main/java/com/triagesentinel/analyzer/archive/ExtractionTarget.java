package com.triagesentinel.analyzer.archive;

import com.triagesentinel.analyzer.archive.ExtractionException.Reason;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.stream.Stream;

/**
 * Bounded write surface over one workspace directory.
 *
 * <p>
 * Every member name is resolved lexically against the workspace root and
 * rejected when it is absolute, carries a drive prefix, or normalises to a
 * location outside the root. Backslashes are treated as separators so that
 * Windows-style {@code ..\..\} sequences are caught as well. Written files
 * and decoded bytes are counted against the configured caps while streaming.
 * </p>
 *
 * @author Naveed Gung
 */
public class ExtractionTarget {

    private static final int BUFFER_SIZE = 16 * 1024;

    private final Path root;
    private final int maxMembers;
    private final long maxBytes;

    private int filesWritten;
    private long bytesWritten;

    public ExtractionTarget(Path root, int maxMembers, long maxBytes) {
        this.root = root.toAbsolutePath().normalize();
        this.maxMembers = maxMembers;
        this.maxBytes = maxBytes;
    }

    public Path getRoot() {
        return root;
    }

    public int getFilesWritten() {
        return filesWritten;
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    /**
     * Check totals an archive declares about itself before anything is written.
     *
     * @throws ExtractionException with {@link Reason#COUNT_EXCEEDED} or
     *                             {@link Reason#SIZE_EXCEEDED}
     */
    public void checkDeclared(int members, long bytes) throws ExtractionException {
        if (members > maxMembers) {
            throw new ExtractionException(Reason.COUNT_EXCEEDED, "Too many files in archive (" + members + ")");
        }
        if (bytes > maxBytes) {
            throw new ExtractionException(Reason.SIZE_EXCEEDED,
                    "Declared size " + bytes + " exceeds " + maxBytes + " bytes");
        }
    }

    /**
     * Check the bytes currently on disk under the workspace.
     *
     * @throws ExtractionException with {@link Reason#SIZE_EXCEEDED}
     */
    public void checkBytesOnDisk() throws IOException, ExtractionException {
        long onDisk = bytesOnDisk();
        if (onDisk > maxBytes) {
            throw new ExtractionException(Reason.SIZE_EXCEEDED,
                    "Decompressed size " + onDisk + " exceeds " + maxBytes + " bytes");
        }
    }

    /** Total size of the regular files under the workspace. */
    public long bytesOnDisk() throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            long total = 0;
            for (Path path : (Iterable<Path>) walk::iterator) {
                if (Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
                    total += Files.size(path);
                }
            }
            return total;
        }
    }

    /**
     * Validate a member name without writing.
     *
     * @return the resolved destination inside the workspace
     * @throws ExtractionException with {@link Reason#TRAVERSAL_VIOLATION}
     */
    public Path checkMember(String name) throws ExtractionException {
        if (name == null || name.indexOf('\0') >= 0) {
            throw new ExtractionException(Reason.TRAVERSAL_VIOLATION, "Illegal member name");
        }
        String unified = name.replace('\\', '/');
        if (unified.startsWith("/") || unified.matches("^[A-Za-z]:.*")) {
            throw new ExtractionException(Reason.TRAVERSAL_VIOLATION, "Absolute member path: " + name);
        }
        Path resolved;
        try {
            resolved = root.resolve(unified).normalize();
        } catch (InvalidPathException e) {
            throw new ExtractionException(Reason.TRAVERSAL_VIOLATION, "Unresolvable member path: " + name, e);
        }
        if (!resolved.startsWith(root)) {
            throw new ExtractionException(Reason.TRAVERSAL_VIOLATION, "Member escapes workspace: " + name);
        }
        return resolved;
    }

    public void directory(String name) throws ExtractionException {
        Path dir = checkMember(name);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ExtractionException(Reason.BAD_CONTAINER, "Cannot create directory member " + name, e);
        }
    }

    /**
     * Stream one file member to disk, enforcing the member and byte caps.
     */
    public void write(String name, InputStream content) throws ExtractionException {
        Path dest = checkMember(name);
        if (dest.equals(root)) {
            throw new ExtractionException(Reason.BAD_CONTAINER, "Member has no file name: " + name);
        }
        if (filesWritten + 1 > maxMembers) {
            throw new ExtractionException(Reason.COUNT_EXCEEDED,
                    "Too many files in archive (>" + maxMembers + ")");
        }
        try {
            Path parent = dest.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(dest, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = content.read(buffer)) != -1) {
                    bytesWritten += read;
                    if (bytesWritten > maxBytes) {
                        throw new ExtractionException(Reason.SIZE_EXCEEDED,
                                "Decompressed size exceeds " + maxBytes + " bytes");
                    }
                    out.write(buffer, 0, read);
                }
            }
            filesWritten++;
        } catch (IOException e) {
            throw new ExtractionException(Reason.BAD_CONTAINER, "Failed to extract member " + name
                    + ": " + e.getMessage(), e);
        }
    }
}
