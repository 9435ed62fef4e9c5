package com.triagesentinel.analyzer.executable;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Minimal PE32 / PE32+ reader.
 *
 * <p>
 * Walks the DOS header, COFF header, optional header, section table and the
 * import directory. Only named imports are inspected; ordinal imports are
 * skipped. The import walk is bounded so a hostile image with cyclic or
 * oversized tables cannot stall the scan.
 * </p>
 *
 * <p>
 * Header-level damage raises {@link PeFormatException}. Damage inside the
 * import tables ends the import walk early and keeps what was read.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class PeInspector {

    static final List<String> SUSPICIOUS_APIS = List.of(
            "VirtualAlloc",
            "VirtualProtect",
            "CreateRemoteThread",
            "WriteProcessMemory",
            "NtUnmapViewOfSection",
            "QueueUserAPC",
            "SetThreadContext");

    static final double ENTROPY_THRESHOLD = 6.5;

    private static final int MAX_DESCRIPTORS = 4096;
    private static final int MAX_THUNKS = 65536;
    private static final int MAX_NAME = 256;

    private static final int PE32_MAGIC = 0x10b;
    private static final int PE32_PLUS_MAGIC = 0x20b;
    private static final int SECTION_HEADER_SIZE = 40;
    private static final int IMPORT_DESCRIPTOR_SIZE = 20;

    private record Section(String name, long virtualAddress, long virtualSize,
            long rawPointer, long rawSize) {
    }

    /**
     * Inspect an image.
     *
     * @param data     image bytes
     * @param length   number of valid bytes in {@code data}
     * @param fileSize size of the whole file on disk, used for overlay
     *                 detection when {@code data} is a truncated prefix
     */
    public ExecutableFacts inspect(byte[] data, int length, long fileSize) throws PeFormatException {
        Reader r = new Reader(data, length);
        if (length < 64 || r.u16(0) != 0x5A4D) {
            throw new PeFormatException("missing MZ header");
        }
        long peOffset = r.u32(0x3C);
        if (peOffset <= 0 || peOffset + 24 > length || r.u32((int) peOffset) != 0x00004550L) {
            throw new PeFormatException("missing PE signature");
        }
        int pe = (int) peOffset;
        int sectionCount = r.u16(pe + 6);
        int optionalSize = r.u16(pe + 20);
        int optional = pe + 24;
        if (optional + optionalSize > length || optionalSize < 2) {
            throw new PeFormatException("truncated optional header");
        }
        int magic = r.u16(optional);
        boolean plus;
        if (magic == PE32_MAGIC) {
            plus = false;
        } else if (magic == PE32_PLUS_MAGIC) {
            plus = true;
        } else {
            throw new PeFormatException(String.format("unknown optional header magic 0x%x", magic));
        }

        List<Section> sections = readSections(r, optional + optionalSize, sectionCount);

        long importRva = 0;
        int rvaCountOffset = optional + (plus ? 108 : 92);
        int directories = optional + (plus ? 112 : 96);
        if (rvaCountOffset + 4 <= optional + optionalSize) {
            long rvaCount = r.u32(rvaCountOffset);
            if (rvaCount > 1 && directories + 16 <= optional + optionalSize) {
                importRva = r.u32(directories + 8);
            }
        }

        List<String> imports = importRva == 0 ? List.of() : suspiciousImports(r, sections, importRva, plus);

        List<String> highEntropy = new ArrayList<>();
        long furthestRaw = 0;
        boolean packed = false;
        for (Section s : sections) {
            if (s.rawSize() == 0) {
                packed = true;
            }
            furthestRaw = Math.max(furthestRaw, s.rawPointer() + s.rawSize());
            long start = Math.min(s.rawPointer(), length);
            long end = Math.min(s.rawPointer() + s.rawSize(), length);
            if (end > start && entropy(data, (int) start, (int) end) > ENTROPY_THRESHOLD) {
                highEntropy.add(s.name());
            }
        }
        boolean overlay = !sections.isEmpty() && fileSize > furthestRaw;

        return new ExecutableFacts(imports, highEntropy, overlay, packed);
    }

    private List<Section> readSections(Reader r, int table, int count) throws PeFormatException {
        if (table + (long) count * SECTION_HEADER_SIZE > r.length) {
            throw new PeFormatException("section table exceeds file");
        }
        List<Section> sections = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int at = table + i * SECTION_HEADER_SIZE;
            sections.add(new Section(
                    sectionName(r.data, at),
                    r.u32(at + 12),
                    r.u32(at + 8),
                    r.u32(at + 20),
                    r.u32(at + 16)));
        }
        return sections;
    }

    private static String sectionName(byte[] data, int at) {
        int end = at;
        while (end < at + 8 && data[end] != 0) {
            end++;
        }
        return new String(data, at, end - at, StandardCharsets.ISO_8859_1).strip();
    }

    private List<String> suspiciousImports(Reader r, List<Section> sections, long importRva, boolean plus) {
        Set<String> found = new LinkedHashSet<>();
        long descriptor = toOffset(sections, importRva);
        int thunkSize = plus ? 8 : 4;
        int thunks = 0;
        for (int d = 0; d < MAX_DESCRIPTORS && descriptor >= 0; d++, descriptor += IMPORT_DESCRIPTOR_SIZE) {
            if (!r.has(descriptor, IMPORT_DESCRIPTOR_SIZE)) {
                break;
            }
            int at = (int) descriptor;
            long lookupRva = r.u32(at);
            long nameRva = r.u32(at + 12);
            long firstThunk = r.u32(at + 16);
            if (lookupRva == 0 && nameRva == 0 && firstThunk == 0) {
                break;
            }
            long thunk = toOffset(sections, lookupRva != 0 ? lookupRva : firstThunk);
            while (thunk >= 0 && r.has(thunk, thunkSize) && thunks++ < MAX_THUNKS) {
                long entry = plus ? r.u64((int) thunk) : r.u32((int) thunk);
                if (entry == 0) {
                    break;
                }
                boolean byOrdinal = plus ? entry < 0 : (entry & 0x80000000L) != 0;
                if (!byOrdinal) {
                    String name = importName(r, toOffset(sections, entry & 0x7FFFFFFFL));
                    if (name != null && isSuspicious(name)) {
                        found.add(name);
                    }
                }
                thunk += thunkSize;
            }
            if (thunks >= MAX_THUNKS) {
                break;
            }
        }
        return List.copyOf(found);
    }

    private static String importName(Reader r, long hintOffset) {
        if (hintOffset < 0 || !r.has(hintOffset, 3)) {
            return null;
        }
        int start = (int) hintOffset + 2;
        int end = start;
        while (end < r.length && end - start < MAX_NAME && r.data[end] != 0) {
            end++;
        }
        return end == start ? null : new String(r.data, start, end - start, StandardCharsets.ISO_8859_1);
    }

    static boolean isSuspicious(String importName) {
        for (String api : SUSPICIOUS_APIS) {
            if (importName.contains(api)) {
                return true;
            }
        }
        return false;
    }

    private static long toOffset(List<Section> sections, long rva) {
        for (Section s : sections) {
            long span = Math.max(s.virtualSize(), s.rawSize());
            if (rva >= s.virtualAddress() && rva < s.virtualAddress() + span) {
                return rva - s.virtualAddress() + s.rawPointer();
            }
        }
        return -1;
    }

    /**
     * Shannon entropy in bits per byte of {@code data[from, to)}.
     */
    public static double entropy(byte[] data, int from, int to) {
        int n = to - from;
        if (n <= 0) {
            return 0.0;
        }
        long[] counts = new long[256];
        for (int i = from; i < to; i++) {
            counts[data[i] & 0xFF]++;
        }
        double h = 0.0;
        for (long c : counts) {
            if (c > 0) {
                double p = (double) c / n;
                h -= p * (Math.log(p) / Math.log(2));
            }
        }
        return h;
    }

    /** Little-endian bounded reads. */
    private static final class Reader {
        final byte[] data;
        final int length;

        Reader(byte[] data, int length) {
            this.data = data;
            this.length = Math.min(length, data.length);
        }

        boolean has(long offset, int size) {
            return offset >= 0 && offset + size <= length;
        }

        int u16(int at) throws PeFormatException {
            if (!has(at, 2)) {
                throw new PeFormatException("read past end at " + at);
            }
            return (data[at] & 0xFF) | (data[at + 1] & 0xFF) << 8;
        }

        long u32(int at) {
            if (!has(at, 4)) {
                return 0;
            }
            return (data[at] & 0xFFL)
                    | (data[at + 1] & 0xFFL) << 8
                    | (data[at + 2] & 0xFFL) << 16
                    | (data[at + 3] & 0xFFL) << 24;
        }

        long u64(int at) {
            return u32(at) | u32(at + 4) << 32;
        }
    }
}
