package com.triagesentinel.analyzer.analysis;

import com.triagesentinel.analyzer.archive.ArchiveFormat;

import java.util.Optional;

/**
 * Capability tag chosen once per artifact from its sniffed MIME type.
 *
 * <ul>
 * <li>{@link #CONTAINER} - unpacked and recursed into, no leaf facets</li>
 * <li>{@link #EXECUTABLE} - signatures, indicators and executable inspection</li>
 * <li>{@link #GENERIC} - signatures and indicators</li>
 * </ul>
 *
 * @author Naveed Gung
 */
public enum ArtifactKind {

    CONTAINER,
    EXECUTABLE,
    GENERIC;

    public static ArtifactKind forMimeType(String mimeType) {
        if (ArchiveFormat.fromMimeType(mimeType).isPresent()) {
            return CONTAINER;
        }
        if (ContentSniffer.PE_MIME.equals(mimeType)) {
            return EXECUTABLE;
        }
        return GENERIC;
    }

    public boolean inspectsExecutable() {
        return this == EXECUTABLE;
    }

    public Optional<ArchiveFormat> archiveFormat(String mimeType) {
        return this == CONTAINER ? ArchiveFormat.fromMimeType(mimeType) : Optional.empty();
    }
}
