package com.triagesentinel.analyzer.archive;

import java.nio.file.Path;
import java.util.Set;

/**
 * Decoder for one family of container formats.
 *
 * <p>
 * Codecs only decode. Path validation, member and byte budgets are enforced
 * by the {@link ExtractionTarget} they write through.
 * </p>
 *
 * @author Naveed Gung
 */
public interface ArchiveCodec {

    /** Sentinel for formats that carry no member count. */
    int UNKNOWN_COUNT = -1;

    Set<ArchiveFormat> formats();

    /**
     * Count members from archive metadata without writing anything. Codecs
     * that read member names here must validate them through
     * {@link ExtractionTarget#checkMember(String)}.
     *
     * @return the declared count of file members, or {@link #UNKNOWN_COUNT}
     */
    int declaredMemberCount(Path archive, ArchiveFormat format, ExtractionTarget target)
            throws ExtractionException;

    /** Decode every member into the target. */
    void extract(Path archive, ArchiveFormat format, ExtractionTarget target) throws ExtractionException;
}
