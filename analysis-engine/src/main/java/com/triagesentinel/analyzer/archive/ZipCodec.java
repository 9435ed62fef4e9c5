package com.triagesentinel.analyzer.archive;

import com.triagesentinel.analyzer.archive.ExtractionException.Reason;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Zip decoder backed by the central directory.
 *
 * <p>
 * All member names are validated before the first byte is written. Symbolic
 * link entries and entries whose data cannot be read (encrypted or an
 * unsupported compression method) are skipped.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@Order(1)
public class ZipCodec implements ArchiveCodec {

    private static final Logger log = LoggerFactory.getLogger(ZipCodec.class);

    @Override
    public Set<ArchiveFormat> formats() {
        return Set.of(ArchiveFormat.ZIP);
    }

    @Override
    public int declaredMemberCount(Path archive, ArchiveFormat format, ExtractionTarget target)
            throws ExtractionException {
        try (ZipFile zip = open(archive)) {
            int files = 0;
            for (ZipArchiveEntry entry : entries(zip)) {
                target.checkMember(entry.getName());
                if (!entry.isDirectory()) {
                    files++;
                }
            }
            return files;
        } catch (IOException e) {
            throw new ExtractionException(Reason.BAD_CONTAINER, "Unreadable zip: " + e.getMessage(), e);
        }
    }

    @Override
    public void extract(Path archive, ArchiveFormat format, ExtractionTarget target) throws ExtractionException {
        try (ZipFile zip = open(archive)) {
            List<ZipArchiveEntry> entries = entries(zip);
            for (ZipArchiveEntry entry : entries) {
                target.checkMember(entry.getName());
            }
            for (ZipArchiveEntry entry : entries) {
                if (entry.isDirectory()) {
                    target.directory(entry.getName());
                } else if (entry.isUnixSymlink()) {
                    log.warn("Skipping symbolic link member {} in {}", entry.getName(), archive);
                } else if (!zip.canReadEntryData(entry)) {
                    log.warn("Skipping unreadable member {} in {} (encrypted or unsupported method)",
                            entry.getName(), archive);
                } else {
                    try (InputStream in = zip.getInputStream(entry)) {
                        target.write(entry.getName(), in);
                    }
                }
            }
        } catch (IOException e) {
            throw new ExtractionException(Reason.BAD_CONTAINER, "Corrupt zip: " + e.getMessage(), e);
        }
    }

    private static ZipFile open(Path archive) throws IOException {
        return ZipFile.builder().setPath(archive).get();
    }

    private static List<ZipArchiveEntry> entries(ZipFile zip) {
        return Collections.list(zip.getEntries());
    }
}
