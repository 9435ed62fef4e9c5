package com.triagesentinel.analyzer.archive;

import java.util.Optional;
import java.util.Set;

/**
 * Container formats the pipeline unpacks, keyed by sniffed MIME type.
 *
 * @author Naveed Gung
 */
public enum ArchiveFormat {

    ZIP(Set.of("application/zip", "application/x-zip-compressed")),
    TAR(Set.of("application/x-tar")),
    GZIP(Set.of("application/gzip", "application/x-gzip")),
    BZIP2(Set.of("application/x-bzip2")),
    RAR(Set.of("application/x-rar-compressed", "application/vnd.rar")),
    SEVEN_ZIP(Set.of("application/x-7z-compressed"));

    private final Set<String> mimeTypes;

    ArchiveFormat(Set<String> mimeTypes) {
        this.mimeTypes = mimeTypes;
    }

    public Set<String> getMimeTypes() {
        return mimeTypes;
    }

    public static Optional<ArchiveFormat> fromMimeType(String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        for (ArchiveFormat format : values()) {
            if (format.mimeTypes.contains(mimeType)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
