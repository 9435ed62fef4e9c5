package com.triagesentinel.analyzer.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Classifies files by their leading bytes, never by name.
 *
 * <p>
 * Only the formats the pipeline acts on are recognised; anything else is
 * reported as {@code text/plain} when the sampled bytes are printable and
 * {@code application/octet-stream} otherwise.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class ContentSniffer {

    private static final Logger log = LoggerFactory.getLogger(ContentSniffer.class);

    public static final String ZIP_MIME = "application/zip";
    public static final String RAR_MIME = "application/x-rar-compressed";
    public static final String SEVEN_ZIP_MIME = "application/x-7z-compressed";
    public static final String GZIP_MIME = "application/gzip";
    public static final String BZIP2_MIME = "application/x-bzip2";
    public static final String TAR_MIME = "application/x-tar";
    public static final String PE_MIME = "application/x-dosexec";
    public static final String ELF_MIME = "application/x-executable";
    public static final String PDF_MIME = "application/pdf";
    public static final String EMPTY_MIME = "application/x-empty";
    public static final String TEXT_MIME = "text/plain";
    public static final String BINARY_MIME = "application/octet-stream";
    public static final String UNKNOWN_MIME = "unknown";

    /** Enough to cover the tar header magic at offset 257 and a text sample. */
    private static final int SAMPLE_SIZE = 8192;

    private static final int TAR_MAGIC_OFFSET = 257;

    private static final byte[] ZIP_LOCAL = {'P', 'K', 3, 4};
    private static final byte[] ZIP_EMPTY = {'P', 'K', 5, 6};
    private static final byte[] ZIP_SPANNED = {'P', 'K', 7, 8};
    private static final byte[] RAR = {'R', 'a', 'r', '!', 0x1A, 0x07};
    private static final byte[] SEVEN_ZIP = {'7', 'z', (byte) 0xBC, (byte) 0xAF, 0x27, 0x1C};
    private static final byte[] GZIP = {0x1F, (byte) 0x8B};
    private static final byte[] BZIP2 = {'B', 'Z', 'h'};
    private static final byte[] USTAR = "ustar".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] MZ = {'M', 'Z'};
    private static final byte[] ELF = {0x7F, 'E', 'L', 'F'};
    private static final byte[] PDF = "%PDF".getBytes(StandardCharsets.US_ASCII);

    /**
     * Determine the MIME type of a file from its content.
     *
     * @param file the file to inspect
     * @return a MIME type, or {@code "unknown"} if the file cannot be read
     */
    public String sniff(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return sniff(in.readNBytes(SAMPLE_SIZE));
        } catch (IOException e) {
            log.error("Failed to get file type for {}: {}", file, e.getMessage());
            return UNKNOWN_MIME;
        }
    }

    /** Classify an in-memory sample (the first bytes of a file). */
    public String sniff(byte[] head) {
        if (head.length == 0) {
            return EMPTY_MIME;
        }
        if (startsWith(head, ZIP_LOCAL) || startsWith(head, ZIP_EMPTY) || startsWith(head, ZIP_SPANNED)) {
            return ZIP_MIME;
        }
        if (startsWith(head, RAR)) {
            return RAR_MIME;
        }
        if (startsWith(head, SEVEN_ZIP)) {
            return SEVEN_ZIP_MIME;
        }
        if (startsWith(head, GZIP)) {
            return GZIP_MIME;
        }
        if (startsWith(head, BZIP2)) {
            return BZIP2_MIME;
        }
        if (regionMatches(head, TAR_MAGIC_OFFSET, USTAR)) {
            return TAR_MIME;
        }
        if (startsWith(head, MZ)) {
            return PE_MIME;
        }
        if (startsWith(head, ELF)) {
            return ELF_MIME;
        }
        if (startsWith(head, PDF)) {
            return PDF_MIME;
        }
        return looksLikeText(head) ? TEXT_MIME : BINARY_MIME;
    }

    private static boolean startsWith(byte[] data, byte[] magic) {
        return regionMatches(data, 0, magic);
    }

    private static boolean regionMatches(byte[] data, int offset, byte[] magic) {
        if (data.length < offset + magic.length) {
            return false;
        }
        return Arrays.equals(data, offset, offset + magic.length, magic, 0, magic.length);
    }

    /** No NUL bytes and at most 5% control characters outside whitespace. */
    private static boolean looksLikeText(byte[] sample) {
        int control = 0;
        for (byte b : sample) {
            int c = b & 0xFF;
            if (c == 0) {
                return false;
            }
            if (c < 0x20 && c != '\n' && c != '\r' && c != '\t' && c != '\f') {
                control++;
            }
        }
        return control * 20 <= sample.length;
    }
}
