package com.triagesentinel.analyzer.archive;

import com.triagesentinel.analyzer.TestFixtures;
import com.triagesentinel.analyzer.archive.ExtractionException.Reason;
import com.triagesentinel.analyzer.config.ExtractionConfig;
import com.triagesentinel.analyzer.config.PipelineConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveExtractorTest {

    @TempDir
    Path root;

    private PipelineConfig config;
    private ExtractionConfig extraction;
    private SimpleMeterRegistry registry;
    private ArchiveExtractor extractor;

    @BeforeEach
    void setUp() {
        config = TestFixtures.pipelineConfig(root);
        extraction = new ExtractionConfig();
        registry = new SimpleMeterRegistry();
        extractor = TestFixtures.archiveExtractor(config, extraction, registry);
    }

    @Test
    void shouldExtractZipIntoFreshWorkspaceAndDeleteOnClose() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("readme.txt", TestFixtures.text("hello"));
        members.put("nested/deeper/data.bin", new byte[] {1, 2, 3});
        Path zip = write("sample.zip", TestFixtures.zip(members));

        Path dir;
        try (ExtractionWorkspace workspace = extractor.extract(zip, ArchiveFormat.ZIP)) {
            dir = workspace.getDirectory();
            assertTrue(dir.startsWith(extractor.getScratchRoot()));
            assertTrue(dir.getFileName().toString().startsWith("sample_"));
            List<Path> files = workspace.files();
            assertEquals(2, files.size());
            assertEquals("hello", Files.readString(dir.resolve("readme.txt")));
            assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(dir.resolve("nested/deeper/data.bin")));
        }
        assertFalse(Files.exists(dir));
    }

    @Test
    void shouldAllocateDistinctWorkspacesForSameArchive() throws Exception {
        Path zip = write("twice.zip", TestFixtures.zip(Map.of("a.txt", TestFixtures.text("a"))));

        try (ExtractionWorkspace first = extractor.extract(zip, ArchiveFormat.ZIP);
                ExtractionWorkspace second = extractor.extract(zip, ArchiveFormat.ZIP)) {
            assertNotEquals(first.getDirectory(), second.getDirectory());
        }
    }

    @Test
    void shouldRejectZipSlipWithoutWritingOutside() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("innocent.txt", TestFixtures.text("fine"));
        members.put("../../evil", TestFixtures.text("pwned"));
        Path zip = write("slip.zip", TestFixtures.zip(members));

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> extractor.extract(zip, ArchiveFormat.ZIP));

        assertEquals(Reason.TRAVERSAL_VIOLATION, e.getReason());
        assertFalse(Files.exists(root.resolve("evil")));
        assertScratchEmpty();
        assertEquals(1.0, registry.get("sentinel.extraction.rejected")
                .tag("reason", "traversal-violation").counter().count());
    }

    @Test
    void shouldRejectAbsoluteAndBackslashTraversalNames() throws Exception {
        Path absolute = write("abs.zip", TestFixtures.zip(Map.of("/etc/cron.d/job", TestFixtures.text("x"))));
        Path windows = write("win.zip", TestFixtures.zip(Map.of("..\\..\\evil.dll", TestFixtures.text("x"))));

        assertEquals(Reason.TRAVERSAL_VIOLATION,
                assertThrows(ExtractionException.class, () -> extractor.extract(absolute, ArchiveFormat.ZIP))
                        .getReason());
        assertEquals(Reason.TRAVERSAL_VIOLATION,
                assertThrows(ExtractionException.class, () -> extractor.extract(windows, ArchiveFormat.ZIP))
                        .getReason());
        assertScratchEmpty();
    }

    @Test
    void shouldRejectTarSlip() throws Exception {
        Path tar = write("slip.tar.gz", tarGz(Map.of("../outside.txt", TestFixtures.text("x"))));

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> extractor.extract(tar, ArchiveFormat.GZIP));

        assertEquals(Reason.TRAVERSAL_VIOLATION, e.getReason());
        assertFalse(Files.exists(root.resolve("scratch").resolve("outside.txt")));
        assertScratchEmpty();
    }

    @Test
    void shouldRejectArchiveDeclaringTooManyMembers() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        for (int i = 0; i < 150; i++) {
            members.put("f" + i + ".txt", TestFixtures.text("x" + i));
        }
        Path zip = write("bomb.zip", TestFixtures.zip(members));

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> extractor.extract(zip, ArchiveFormat.ZIP));

        assertEquals(Reason.COUNT_EXCEEDED, e.getReason());
        assertScratchEmpty();
    }

    @Test
    void shouldRejectDeclaredCountBeforeDecoding() throws Exception {
        AtomicBoolean decoded = new AtomicBoolean();
        ArchiveCodec lying = new StubCodec(150, target -> decoded.set(true));
        ArchiveExtractor stubbed = new ArchiveExtractor(List.of(lying), config, extraction, registry);
        Path archive = write("declared.zip", new byte[] {'P', 'K', 3, 4});

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> stubbed.extract(archive, ArchiveFormat.ZIP));

        assertEquals(Reason.COUNT_EXCEEDED, e.getReason());
        assertFalse(decoded.get());
        assertScratchEmpty();
    }

    @Test
    void shouldRecountFilesWhenMetadataUnderReports() throws Exception {
        ArchiveCodec underReporting = new StubCodec(50, target -> {
            for (int i = 0; i < 150; i++) {
                Files.writeString(target.getRoot().resolve("m" + i + ".txt"), "x");
            }
        });
        ArchiveExtractor stubbed = new ArchiveExtractor(List.of(underReporting), config, extraction, registry);
        Path archive = write("liar.zip", new byte[] {'P', 'K', 3, 4});

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> stubbed.extract(archive, ArchiveFormat.ZIP));

        assertEquals(Reason.COUNT_EXCEEDED, e.getReason());
        assertTrue(e.getMessage().contains("150"));
        assertScratchEmpty();
    }

    @Test
    void shouldCountTarMembersFromHeaders() throws Exception {
        extraction.setMaxMembers(3);
        ArchiveExtractor small = TestFixtures.archiveExtractor(config, extraction, registry);
        Path tar = write("many.tar.gz", tarGz(Map.of(
                "a.txt", TestFixtures.text("a"),
                "b.txt", TestFixtures.text("b"),
                "c.txt", TestFixtures.text("c"),
                "d.txt", TestFixtures.text("d"))));

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> small.extract(tar, ArchiveFormat.GZIP));

        assertEquals(Reason.COUNT_EXCEEDED, e.getReason());
        assertScratchEmpty();
    }

    @Test
    void shouldEnforceByteBudget() throws Exception {
        extraction.setMaxExtractedBytes(1024);
        ArchiveExtractor small = TestFixtures.archiveExtractor(config, extraction, registry);
        Path zip = write("big.zip", TestFixtures.zip(Map.of("zeros.bin", new byte[64 * 1024])));

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> small.extract(zip, ArchiveFormat.ZIP));

        assertEquals(Reason.SIZE_EXCEEDED, e.getReason());
        assertScratchEmpty();
    }

    @Test
    void shouldExtractTarGzMembers() throws Exception {
        Path tar = write("bundle.tgz", tarGz(Map.of("docs/a.txt", TestFixtures.text("alpha"))));

        try (ExtractionWorkspace workspace = extractor.extract(tar, ArchiveFormat.GZIP)) {
            assertEquals("alpha", Files.readString(workspace.getDirectory().resolve("docs/a.txt")));
        }
    }

    @Test
    void shouldTreatPlainGzipAsSingleMember() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream gz = new GzipCompressorOutputStream(bytes)) {
            gz.write("just text".getBytes(StandardCharsets.US_ASCII));
        }
        Path gzip = write("notes.txt.gz", bytes.toByteArray());

        try (ExtractionWorkspace workspace = extractor.extract(gzip, ArchiveFormat.GZIP)) {
            List<Path> files = workspace.files();
            assertEquals(1, files.size());
            assertEquals("notes.txt", files.get(0).getFileName().toString());
            assertEquals("just text", Files.readString(files.get(0)));
        }
    }

    @Test
    void shouldReportBadContainer() throws Exception {
        Path broken = write("broken.zip", new byte[] {'P', 'K', 3, 4, 0, 0, 0});

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> extractor.extract(broken, ArchiveFormat.ZIP));

        assertEquals(Reason.BAD_CONTAINER, e.getReason());
        assertScratchEmpty();
    }

    @Test
    void shouldReportMissingExternalExtractor() throws Exception {
        extraction.setExternalTools(List.of(new ExtractionConfig.ExternalTool(
                "definitely-not-installed-lister {archive}", "definitely-not-installed-extractor {archive} {out}")));
        ArchiveExtractor external = TestFixtures.archiveExtractor(config, extraction, registry);
        Path rar = write("x.rar", new byte[] {'R', 'a', 'r', '!', 0x1A, 0x07, 0});

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> external.extract(rar, ArchiveFormat.RAR));

        assertEquals(Reason.NO_EXTRACTOR, e.getReason());
        assertScratchEmpty();
    }

    @Test
    void shouldPruneOnlyStaleWorkspaces() throws Exception {
        Path scratch = extractor.getScratchRoot();
        Path stale = Files.createDirectories(scratch.resolve("old_1_abcd"));
        Path fresh = Files.createDirectories(scratch.resolve("new_2_efgh"));
        Files.setLastModifiedTime(stale,
                FileTime.fromMillis(System.currentTimeMillis() - 3_600_000L * 3));

        int removed = extractor.pruneStaleWorkspaces(Duration.ofHours(1));

        assertEquals(1, removed);
        assertFalse(Files.exists(stale));
        assertTrue(Files.exists(fresh));
    }

    @Test
    void shouldNotPruneWorkspaceStillInUse() throws Exception {
        Path zip = write("live.zip", TestFixtures.zip(Map.of("a.txt", TestFixtures.text("a"))));
        FileTime longAgo = FileTime.fromMillis(System.currentTimeMillis() - 3_600_000L * 3);

        try (ExtractionWorkspace workspace = extractor.extract(zip, ArchiveFormat.ZIP)) {
            Files.setLastModifiedTime(workspace.getDirectory(), longAgo);

            assertEquals(0, extractor.pruneStaleWorkspaces(Duration.ofHours(1)));
            assertTrue(Files.exists(workspace.getDirectory().resolve("a.txt")));

            workspace.touch();
            assertTrue(Files.getLastModifiedTime(workspace.getDirectory()).compareTo(longAgo) > 0);
        }
        assertScratchEmpty();
    }

    @Test
    void shouldPruneWorkspaceOnceReleased() throws Exception {
        Path zip = write("done.zip", TestFixtures.zip(Map.of("a.txt", TestFixtures.text("a"))));
        Path dir;
        try (ExtractionWorkspace workspace = extractor.extract(zip, ArchiveFormat.ZIP)) {
            dir = workspace.getDirectory();
        }
        Path leftover = Files.createDirectories(dir);
        Files.setLastModifiedTime(leftover, FileTime.fromMillis(System.currentTimeMillis() - 3_600_000L * 3));

        assertEquals(1, extractor.pruneStaleWorkspaces(Duration.ofHours(1)));
        assertFalse(Files.exists(leftover));
    }

    @Test
    void shouldSanitizeWorkspaceNames() {
        assertEquals("evil_name", ArchiveExtractor.sanitize("evil name.zip"));
        assertEquals("archive", ArchiveExtractor.sanitize(".."));
        assertEquals(48, ArchiveExtractor.sanitize("a".repeat(100) + ".zip").length());
    }

    private void assertScratchEmpty() throws IOException {
        Path scratch = extractor.getScratchRoot();
        if (!Files.exists(scratch)) {
            return;
        }
        try (Stream<Path> children = Files.list(scratch)) {
            assertEquals(0, children.count(), "workspace left behind in " + scratch);
        }
    }

    private Path write(String name, byte[] content) throws IOException {
        Path file = root.resolve("in").resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, content);
        return file;
    }

    private static byte[] tarGz(Map<String, byte[]> members) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new GzipCompressorOutputStream(bytes))) {
            for (Map.Entry<String, byte[]> member : new TreeMap<>(members).entrySet()) {
                TarArchiveEntry entry = new TarArchiveEntry(member.getKey(), true);
                entry.setSize(member.getValue().length);
                tar.putArchiveEntry(entry);
                tar.write(member.getValue());
                tar.closeArchiveEntry();
            }
        }
        return bytes.toByteArray();
    }

    @FunctionalInterface
    private interface Decode {
        void run(ExtractionTarget target) throws IOException;
    }

    /** Codec with a fixed declared count and scripted decoding. */
    private static final class StubCodec implements ArchiveCodec {

        private final int declared;
        private final Decode decode;

        StubCodec(int declared, Decode decode) {
            this.declared = declared;
            this.decode = decode;
        }

        @Override
        public Set<ArchiveFormat> formats() {
            return Set.of(ArchiveFormat.ZIP);
        }

        @Override
        public int declaredMemberCount(Path archive, ArchiveFormat format, ExtractionTarget target) {
            return declared;
        }

        @Override
        public void extract(Path archive, ArchiveFormat format, ExtractionTarget target) throws ExtractionException {
            try {
                decode.run(target);
            } catch (IOException e) {
                throw new ExtractionException(Reason.BAD_CONTAINER, e.getMessage(), e);
            }
        }
    }
}
