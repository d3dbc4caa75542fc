package com.largomodo.debpartial.index;

import com.largomodo.debpartial.core.PartitionObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SourceCatalogTest {

    private SourceCatalog catalog;
    private PartitionObserver observer;

    @BeforeEach
    void setUp() {
        catalog = new SourceCatalog();
        observer = mock(PartitionObserver.class);
    }

    private static SourceRecord source(String name, String directory, List<String> binaries, long... sizes) {
        List<SourceRecord.SourceFile> files = new java.util.ArrayList<>();
        for (int i = 0; i < sizes.length; i++) {
            files.add(new SourceRecord.SourceFile(name + "_" + i, sizes[i]));
        }
        return new SourceRecord(name, directory, binaries, files);
    }

    @Test
    void testSizeIsSumOfFiles() {
        catalog.register(source("glibc", "pool/main/g/glibc", List.of("libc6", "libc-bin"), 100, 2000, 30));

        assertEquals(2130, catalog.sizeOf("glibc"));
        assertEquals(2130, catalog.sizeOf(List.of("glibc", "unknown")));
    }

    @Test
    void testSameDirectoryAndFileCountedOnceAcrossDistributions() {
        catalog.register(source("glibc", "pool/main/g/glibc", List.of("libc6"), 100, 2000));
        catalog.register(source("glibc", "pool/main/g/glibc", List.of("libc6"), 100, 2000));

        assertEquals(2100, catalog.sizeOf("glibc"));
        assertEquals(1, catalog.size());
    }

    @Test
    void testBinaryMapsToItsSource() {
        catalog.register(source("glibc", "pool/main/g/glibc", List.of("libc6", "libc-bin"), 1));

        assertEquals("glibc", catalog.sourceOf("libc-bin", observer).orElseThrow());
        verifyNoInteractions(observer);
    }

    @Test
    void testMissingSourceReportedOncePerBinary() {
        assertTrue(catalog.sourceOf("orphan", observer).isEmpty());
        assertTrue(catalog.sourceOf("orphan", observer).isEmpty());
        assertTrue(catalog.sourceOf("other", observer).isEmpty());

        verify(observer, times(1)).onMissingSource("orphan");
        verify(observer, times(1)).onMissingSource("other");
    }

    @Test
    void testSourcesOfIsDistinctAndOrdered() {
        catalog.register(source("glibc", "g", List.of("libc6", "libc-bin"), 1));
        catalog.register(source("bash", "b", List.of("bash"), 1));

        List<String> sources = catalog.sourcesOf(List.of("bash", "libc6", "orphan", "libc-bin"), observer);

        assertEquals(List.of("bash", "glibc"), sources);
        verify(observer).onMissingSource("orphan");
    }

    @Test
    void testFromStanzaParsesFoldedBinariesAndFiles() {
        Stanza stanza = Stanza.parse(List.of(
                "Package: glibc",
                "Binary: libc6, libc-bin,",
                " libc6-dev",
                "Directory: pool/main/g/glibc",
                "Files:",
                " 0123abcd 2000 glibc_2.36.dsc",
                " 4567ef01 18000000 glibc_2.36.orig.tar.xz",
                " malformed line"));

        SourceRecord record = SourceRecord.fromStanza(stanza).orElseThrow();

        assertEquals(List.of("libc6", "libc-bin", "libc6-dev"), record.binaries());
        assertEquals(2, record.files().size());
        assertEquals(18_002_000L, record.size());
        assertEquals("pool/main/g/glibc/glibc_2.36.dsc", record.pathOf(record.files().get(0)));
    }

    @Test
    void testFromStanzaFallsBackToSha256List() {
        Stanza stanza = Stanza.parse(List.of(
                "Package: hello",
                "Checksums-Sha256:",
                " aaaa 10 hello.dsc"));

        SourceRecord record = SourceRecord.fromStanza(stanza).orElseThrow();

        assertEquals(10, record.size());
        assertEquals("", record.directory());
        assertTrue(record.binaries().isEmpty());
    }

    @Test
    void testFromStanzaWithoutPackageIsEmpty() {
        assertTrue(SourceRecord.fromStanza(Stanza.parse(List.of("Binary: x"))).isEmpty());
    }
}
