package com.largomodo.debpartial.service;

import com.largomodo.debpartial.ArchiveFixture;
import com.largomodo.debpartial.index.IndexReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testCatalogOrderFollowsArchThenDistThenSection() throws IOException {
        ArchiveLayout layout = new ArchiveLayout(List.of("stable", "unstable"), List.of("main", "contrib"),
                List.of("i386"));
        new ArchiveFixture(tempDir)
                .binary("unstable", "contrib", "i386", "d", 1)
                .binary("unstable", "main", "i386", "c", 1)
                .binary("stable", "contrib", "i386", "b", 1)
                .binary("stable", "main", "i386", "a", 1)
                .write(layout);

        LoadedArchive archive = new ArchiveLoader(layout).load(tempDir, true);

        assertEquals(List.of("a", "b", "c", "d"), archive.packages().names());
        assertNotNull(archive.binaryIndex("unstable", "contrib", "i386"));
        assertNotNull(archive.sourceIndex("stable", "main"));
        assertNull(archive.binaryIndex("unstable", "main", "amd64"));
    }

    @Test
    void testSourcesSkippedWhenNotHandled() throws IOException {
        ArchiveLayout layout = new ArchiveLayout(List.of("unstable"), List.of("main"), List.of("i386"));
        new ArchiveFixture(tempDir)
                .binary("unstable", "main", "i386", "a", 1)
                .source("unstable", "main", "sa", 5, "a")
                .write(layout);
        Files.delete(layout.sourcesIndex(tempDir, "unstable", "main"));

        LoadedArchive archive = new ArchiveLoader(layout).load(tempDir, false);

        assertEquals(0, archive.sources().size());
        assertNull(archive.sourceIndex("unstable", "main"));
    }

    @Test
    void testMissingIndexAbortsLoad() {
        ArchiveLayout layout = new ArchiveLayout(List.of("unstable"), List.of("main"), List.of("i386"));

        IndexReadException e = assertThrows(IndexReadException.class,
                () -> new ArchiveLoader(layout).load(tempDir, true));

        assertEquals(layout.packagesIndex(tempDir, "unstable", "main", "i386"), e.getDocument());
    }
}
