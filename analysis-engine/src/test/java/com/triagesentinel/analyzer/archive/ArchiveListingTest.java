package com.triagesentinel.analyzer.archive;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveListingTest {

    @Test
    void shouldSkipSevenZipArchiveHeader() {
        ArchiveListing listing = ArchiveListing.parse("""
                7-Zip 23.01 (x64)

                Listing archive: /in/sample.7z

                --
                Path = /in/sample.7z
                Type = 7z
                Physical Size = 4096

                ----------
                Path = bin
                Size = 0
                Attributes = D_ drwxr-xr-x

                Path = bin/tool.exe
                Folder = -
                Size = 2048
                Attributes = A_ -rw-r--r--

                Path = readme.txt
                Size = 12
                """);

        assertEquals(List.of("bin", "bin/tool.exe", "readme.txt"),
                listing.members().stream().map(ArchiveListing.Member::name).toList());
        assertTrue(listing.members().get(0).directory());
        assertEquals(2, listing.fileCount());
        assertEquals(2060, listing.declaredBytes());
    }

    @Test
    void shouldReadUnrarTechnicalListing() {
        ArchiveListing listing = ArchiveListing.parse("""
                UNRAR 6.24 freeware      Copyright (c) 1993-2023 Alexander Roshal

                Archive: /in/sample.rar
                Details: RAR 5

                        Name: docs
                        Type: Directory
                  Attributes: drwxr-xr-x

                        Name: docs/../../evil.txt
                        Type: File
                        Size: 4
                 Packed size: 4
                """);

        assertEquals(2, listing.members().size());
        assertTrue(listing.members().get(0).directory());
        assertEquals("docs/../../evil.txt", listing.members().get(1).name());
        assertEquals(1, listing.fileCount());
        assertEquals(4, listing.declaredBytes());
    }

    @Test
    void shouldTreatUnreadableSizeAsZero() {
        ArchiveListing listing = ArchiveListing.parse("Path = a.bin\nSize = ?\n");

        assertEquals(1, listing.fileCount());
        assertEquals(0, listing.declaredBytes());
    }

    @Test
    void shouldReturnNoMembersForEmptyOutput() {
        assertTrue(ArchiveListing.parse("").members().isEmpty());
    }
}
