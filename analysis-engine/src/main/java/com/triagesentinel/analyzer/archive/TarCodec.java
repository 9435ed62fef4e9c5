package com.triagesentinel.analyzer.archive;

import com.triagesentinel.analyzer.archive.ExtractionException.Reason;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Tar decoder, optionally wrapped in gzip or bzip2.
 *
 * <p>
 * Tar has no central directory, so the declared count comes from a
 * header-only pass that also validates every member name. A gzip or bzip2
 * stream that does not wrap a tar is treated as a single member named after
 * the container with its compression suffix removed.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@Order(2)
public class TarCodec implements ArchiveCodec {

    private static final Logger log = LoggerFactory.getLogger(TarCodec.class);

    /** Bytes needed to recognise a tar header. */
    private static final int TAR_HEADER_BYTES = 512;

    @Override
    public Set<ArchiveFormat> formats() {
        return Set.of(ArchiveFormat.TAR, ArchiveFormat.GZIP, ArchiveFormat.BZIP2);
    }

    @Override
    public int declaredMemberCount(Path archive, ArchiveFormat format, ExtractionTarget target)
            throws ExtractionException {
        try (InputStream in = open(archive, format)) {
            if (!wrapsTar(in)) {
                target.checkMember(singleMemberName(archive));
                return 1;
            }
            int files = 0;
            try (TarArchiveInputStream tar = new TarArchiveInputStream(in)) {
                TarArchiveEntry entry;
                while ((entry = tar.getNextEntry()) != null) {
                    target.checkMember(entry.getName());
                    if (entry.isFile()) {
                        files++;
                    }
                }
            }
            return files;
        } catch (IOException | IllegalArgumentException e) {
            throw new ExtractionException(Reason.BAD_CONTAINER, "Unreadable " + describe(format) + ": "
                    + e.getMessage(), e);
        }
    }

    @Override
    public void extract(Path archive, ArchiveFormat format, ExtractionTarget target) throws ExtractionException {
        try (InputStream in = open(archive, format)) {
            if (!wrapsTar(in)) {
                target.write(singleMemberName(archive), in);
                return;
            }
            try (TarArchiveInputStream tar = new TarArchiveInputStream(in)) {
                TarArchiveEntry entry;
                while ((entry = tar.getNextEntry()) != null) {
                    if (entry.isDirectory()) {
                        target.directory(entry.getName());
                    } else if (entry.isSymbolicLink() || entry.isLink()) {
                        log.warn("Skipping link member {} -> {} in {}", entry.getName(), entry.getLinkName(),
                                archive);
                    } else if (entry.isFile()) {
                        target.write(entry.getName(), tar);
                    } else {
                        log.debug("Skipping special member {} in {}", entry.getName(), archive);
                    }
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ExtractionException(Reason.BAD_CONTAINER, "Corrupt " + describe(format) + ": "
                    + e.getMessage(), e);
        }
    }

    private static InputStream open(Path archive, ArchiveFormat format) throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
        try {
            InputStream decoded = switch (format) {
                case GZIP -> new GzipCompressorInputStream(raw, true);
                case BZIP2 -> new BZip2CompressorInputStream(raw, true);
                default -> raw;
            };
            return new BufferedInputStream(decoded);
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }

    /** Peek at the first header block without consuming it. */
    private static boolean wrapsTar(InputStream in) throws IOException {
        in.mark(TAR_HEADER_BYTES);
        byte[] header = in.readNBytes(TAR_HEADER_BYTES);
        in.reset();
        return header.length == TAR_HEADER_BYTES && TarArchiveInputStream.matches(header, header.length);
    }

    static String singleMemberName(Path archive) {
        String name = archive.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tgz") || lower.endsWith(".tbz2")) {
            return name.substring(0, name.lastIndexOf('.')) + ".tar";
        }
        for (String suffix : new String[] {".gz", ".bz2", ".gzip", ".bzip2"}) {
            if (lower.endsWith(suffix) && lower.length() > suffix.length()) {
                return name.substring(0, name.length() - suffix.length());
            }
        }
        return name + ".out";
    }

    private static String describe(ArchiveFormat format) {
        return format.name().toLowerCase(Locale.ROOT);
    }
}
