package com.triagesentinel.analyzer.archive;

import com.triagesentinel.analyzer.archive.ExtractionException.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionTargetTest {

    @TempDir
    Path root;

    private ExtractionTarget target;

    @BeforeEach
    void setUp() throws Exception {
        target = new ExtractionTarget(Files.createDirectory(root.resolve("ws")), 2, 10);
    }

    @Test
    void shouldResolveNestedMembersInsideRoot() throws Exception {
        Path resolved = target.checkMember("a/b/../c.txt");
        assertEquals(root.resolve("ws/a/c.txt").toAbsolutePath().normalize(), resolved);
    }

    @Test
    void shouldRejectEscapingNames() {
        for (String name : new String[] {"../x", "a/../../x", "/abs", "C:\\windows\\x", "..\\x", "a\0b"}) {
            ExtractionException e = assertThrows(ExtractionException.class, () -> target.checkMember(name), name);
            assertEquals(Reason.TRAVERSAL_VIOLATION, e.getReason(), name);
        }
    }

    @Test
    void shouldCountMembersAndBytes() throws Exception {
        target.write("one.txt", new ByteArrayInputStream(new byte[4]));
        target.write("two.txt", new ByteArrayInputStream(new byte[4]));

        assertEquals(2, target.getFilesWritten());
        assertEquals(8, target.getBytesWritten());
        ExtractionException e = assertThrows(ExtractionException.class,
                () -> target.write("three.txt", new ByteArrayInputStream(new byte[1])));
        assertEquals(Reason.COUNT_EXCEEDED, e.getReason());
        assertFalse(Files.exists(root.resolve("ws/three.txt")));
    }

    @Test
    void shouldFailWhenByteBudgetIsExceeded() {
        ExtractionException e = assertThrows(ExtractionException.class,
                () -> target.write("big.bin", new ByteArrayInputStream(new byte[11])));
        assertEquals(Reason.SIZE_EXCEEDED, e.getReason());
    }

    @Test
    void shouldRejectMemberWithoutFileName() {
        ExtractionException e = assertThrows(ExtractionException.class,
                () -> target.write("a/..", new ByteArrayInputStream(new byte[1])));
        assertEquals(Reason.BAD_CONTAINER, e.getReason());
    }
}
