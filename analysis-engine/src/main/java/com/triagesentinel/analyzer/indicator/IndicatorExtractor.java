package com.triagesentinel.analyzer.indicator;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls network indicators out of raw bytes.
 *
 * <p>
 * The bytes are decoded as ISO-8859-1 so every byte maps to exactly one
 * character and binary files scan without decode errors. IPv4 addresses in
 * private, loopback, link-local, documentation, benchmarking and reserved
 * ranges are dropped.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class IndicatorExtractor {

    public static final String URLS = "urls";
    public static final String IPS = "ips";

    private static final Pattern URL = Pattern.compile(
            "https?://[A-Za-z0-9\\-._~:/?#\\[\\]@!$&'()*+,;=%]+");

    private static final Pattern IPV4 = Pattern.compile(
            "(?<![0-9.])((?:25[0-5]|2[0-4][0-9]|1[0-9]{2}|[1-9]?[0-9])"
                    + "(?:\\.(?:25[0-5]|2[0-4][0-9]|1[0-9]{2}|[1-9]?[0-9])){3})(?![0-9]|\\.[0-9])");

    /** Non-public IPv4 blocks as {network, prefix length}. */
    private static final long[][] NON_PUBLIC = {
            {addr(0, 0, 0, 0), 8},
            {addr(10, 0, 0, 0), 8},
            {addr(127, 0, 0, 0), 8},
            {addr(169, 254, 0, 0), 16},
            {addr(172, 16, 0, 0), 12},
            {addr(192, 0, 0, 0), 29},
            {addr(192, 0, 0, 170), 31},
            {addr(192, 0, 2, 0), 24},
            {addr(192, 168, 0, 0), 16},
            {addr(198, 18, 0, 0), 15},
            {addr(198, 51, 100, 0), 24},
            {addr(203, 0, 113, 0), 24},
            {addr(240, 0, 0, 0), 4},
            {addr(255, 255, 255, 255), 32},
    };

    /**
     * Extract indicators from the first {@code length} bytes.
     *
     * @return map with keys {@link #URLS} and {@link #IPS}, values distinct in
     *         first-seen order
     */
    public Map<String, List<String>> extract(byte[] data, int length) {
        String text = new String(data, 0, length, StandardCharsets.ISO_8859_1);

        Set<String> urls = new LinkedHashSet<>();
        Matcher m = URL.matcher(text);
        while (m.find()) {
            urls.add(m.group());
        }

        Set<String> ips = new LinkedHashSet<>();
        m = IPV4.matcher(text);
        while (m.find()) {
            String ip = m.group(1);
            if (isPublic(ip)) {
                ips.add(ip);
            }
        }

        Map<String, List<String>> out = new LinkedHashMap<>();
        out.put(URLS, List.copyOf(urls));
        out.put(IPS, List.copyOf(ips));
        return out;
    }

    /**
     * Whether a dotted-quad string is a routable public IPv4 address.
     */
    public static boolean isPublic(String dottedQuad) {
        String[] parts = dottedQuad.split("\\.");
        if (parts.length != 4) {
            return false;
        }
        long value = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3 || (part.length() > 1 && part.charAt(0) == '0')) {
                return false;
            }
            int octet;
            try {
                octet = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                return false;
            }
            if (octet > 255) {
                return false;
            }
            value = (value << 8) | octet;
        }
        for (long[] block : NON_PUBLIC) {
            long mask = block[1] == 0 ? 0 : (0xFFFFFFFFL << (32 - block[1])) & 0xFFFFFFFFL;
            if ((value & mask) == block[0]) {
                return false;
            }
        }
        return true;
    }

    private static long addr(int a, int b, int c, int d) {
        return ((long) a << 24) | ((long) b << 16) | ((long) c << 8) | d;
    }
}
