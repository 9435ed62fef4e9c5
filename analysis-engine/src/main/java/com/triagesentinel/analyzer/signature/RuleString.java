package com.triagesentinel.analyzer.signature;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One {@code $identifier} pattern of a rule.
 *
 * <p>
 * Each pattern is compiled to one or more byte/mask alternatives: text
 * strings yield an ascii and/or a UTF-16LE variant, hex strings a single
 * variant whose mask clears wildcard nibbles. A mask byte of {@code 0xFF}
 * requires an exact match.
 * </p>
 *
 * @author Naveed Gung
 */
public record RuleString(String identifier, List<Variant> variants, boolean nocase) {

    /** A compiled byte pattern and its per-byte mask. */
    public record Variant(byte[] bytes, byte[] mask) {
    }

    public static RuleString text(String identifier, String value, boolean nocase, boolean ascii, boolean wide) {
        List<Variant> variants = new ArrayList<>(2);
        byte[] raw = value.getBytes(StandardCharsets.ISO_8859_1);
        if (ascii || !wide) {
            variants.add(new Variant(raw, fullMask(raw.length)));
        }
        if (wide) {
            byte[] utf16 = new byte[raw.length * 2];
            for (int i = 0; i < raw.length; i++) {
                utf16[i * 2] = raw[i];
            }
            variants.add(new Variant(utf16, fullMask(utf16.length)));
        }
        return new RuleString(identifier, List.copyOf(variants), nocase);
    }

    public static RuleString hex(String identifier, byte[] bytes, byte[] mask) {
        return new RuleString(identifier, List.of(new Variant(bytes, mask)), false);
    }

    /**
     * @return true if any variant occurs anywhere in the data
     */
    public boolean matches(byte[] data, int length) {
        for (Variant variant : variants) {
            if (indexOf(data, length, variant) >= 0) {
                return true;
            }
        }
        return false;
    }

    private int indexOf(byte[] data, int length, Variant variant) {
        byte[] pattern = variant.bytes();
        byte[] mask = variant.mask();
        int last = length - pattern.length;
        outer:
        for (int i = 0; i <= last; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (!same(data[i + j], pattern[j], mask[j])) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private boolean same(byte actual, byte expected, byte mask) {
        if (nocase) {
            return lower(actual) == lower(expected);
        }
        return (actual & mask) == (expected & mask);
    }

    private static byte lower(byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    private static byte[] fullMask(int length) {
        byte[] mask = new byte[length];
        Arrays.fill(mask, (byte) 0xFF);
        return mask;
    }
}
