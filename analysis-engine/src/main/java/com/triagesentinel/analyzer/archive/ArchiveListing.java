package com.triagesentinel.analyzer.archive;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Member table printed by an external extractor's listing command.
 *
 * <p>
 * Understands the technical listings of {@code 7z l -slt} ({@code Path = },
 * {@code Folder = }, {@code Size = }) and {@code unrar lt} ({@code Name: },
 * {@code Type: }, {@code Size: }). A {@code 7z} listing starts with a block
 * describing the archive itself; only lines after its {@code ----------}
 * separator are read.
 * </p>
 *
 * @author Naveed Gung
 */
record ArchiveListing(List<Member> members) {

    private static final String SEVEN_ZIP_SEPARATOR = "----------";

    record Member(String name, boolean directory, long size) {
    }

    int fileCount() {
        return (int) members.stream().filter(m -> !m.directory()).count();
    }

    long declaredBytes() {
        return members.stream().filter(m -> !m.directory()).mapToLong(Member::size).sum();
    }

    static ArchiveListing parse(String output) {
        List<String> lines = output.lines().toList();
        int start = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).trim().equals(SEVEN_ZIP_SEPARATOR)) {
                start = i + 1;
                break;
            }
        }

        List<Member> members = new ArrayList<>();
        String name = null;
        boolean directory = false;
        long size = 0;
        for (String raw : lines.subList(start, lines.size())) {
            String line = raw.trim();
            String key;
            String value;
            int eq = line.indexOf(" = ");
            int colon = line.indexOf(": ");
            if (eq > 0 && (colon < 0 || eq < colon)) {
                key = line.substring(0, eq);
                value = line.substring(eq + 3);
            } else if (colon > 0) {
                key = line.substring(0, colon);
                value = line.substring(colon + 2);
            } else {
                continue;
            }

            switch (key) {
                case "Path", "Name" -> {
                    if (name != null) {
                        members.add(new Member(name, directory, size));
                    }
                    name = value;
                    directory = false;
                    size = 0;
                }
                case "Folder" -> directory |= value.equals("+");
                case "Type" -> directory |= value.toLowerCase(Locale.ROOT).startsWith("dir");
                case "Attributes" -> directory |= value.startsWith("D");
                case "Size" -> size = parseSize(value);
                default -> {
                }
            }
        }
        if (name != null) {
            members.add(new Member(name, directory, size));
        }
        return new ArchiveListing(List.copyOf(members));
    }

    private static long parseSize(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
