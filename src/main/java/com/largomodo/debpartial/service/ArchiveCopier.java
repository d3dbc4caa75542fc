package com.largomodo.debpartial.service;

import com.largomodo.debpartial.index.SourceRecord;
import com.largomodo.debpartial.index.Stanza;
import com.largomodo.debpartial.index.StanzaReader;
import com.largomodo.debpartial.util.IndexFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Fills a partition tree with the files its indices reference, taken from a full mirror.
 * <p>
 * Every Packages index under the partition contributes its {@code Filename} entries and every
 * Sources index the {@code Directory/name} of each listed file. Files are copied, or linked
 * with a relative symbolic link, to the same archive-relative path. Files already present are
 * left alone, so an interrupted run can simply be repeated.
 */
public class ArchiveCopier {

    private static final Logger log = LoggerFactory.getLogger(ArchiveCopier.class);

    private final Path mirrorRoot;
    private final Path destRoot;
    private final boolean symlink;

    /**
     * @param mirrorRoot full archive the files are taken from
     * @param destRoot   partition tree holding the indices
     * @param symlink    link instead of copying
     */
    public ArchiveCopier(Path mirrorRoot, Path destRoot, boolean symlink) {
        this.mirrorRoot = mirrorRoot.toAbsolutePath().normalize();
        this.destRoot = destRoot.toAbsolutePath().normalize();
        this.symlink = symlink;
    }

    /**
     * @return counters of the run
     * @throws IOException if an index cannot be read or a file cannot be copied
     */
    public CopyStats copyAll() throws IOException {
        Path dists = destRoot.resolve(ArchiveLayout.DISTS);
        if (!Files.isDirectory(dists)) {
            log.warn("No {} directory under {}", ArchiveLayout.DISTS, destRoot);
            return new CopyStats();
        }
        List<Path> indices;
        try (Stream<Path> files = Files.walk(dists)) {
            indices = files
                    .filter(p -> IndexFileMatcher.isPackagesIndex(p) || IndexFileMatcher.isSourcesIndex(p))
                    .sorted()
                    .collect(Collectors.toList());
        }

        CopyStats stats = new CopyStats();
        for (Path index : indices) {
            MDC.put(IndexEmitter.MDC_INDEX, destRoot.relativize(index).toString());
            try {
                copyReferenced(index, stats);
            } finally {
                MDC.remove(IndexEmitter.MDC_INDEX);
            }
        }
        log.info("Done: {}", stats);
        return stats;
    }

    private void copyReferenced(Path index, CopyStats stats) throws IOException {
        List<Stanza> stanzas = StanzaReader.read(index);
        log.info("Processing {} ({} entries)", destRoot.relativize(index), stanzas.size());

        if (IndexFileMatcher.isPackagesIndex(index)) {
            for (Stanza stanza : stanzas) {
                String filename = stanza.field("Filename");
                if (filename != null && !filename.isEmpty()) {
                    copy(filename, stats);
                }
            }
            return;
        }

        for (Stanza stanza : stanzas) {
            var record = SourceRecord.fromStanza(stanza);
            if (record.isEmpty()) {
                continue;
            }
            for (SourceRecord.SourceFile file : record.get().files()) {
                copy(record.get().pathOf(file), stats);
            }
        }
    }

    /**
     * Copies or links one archive-relative file.
     *
     * @param relative path relative to both roots
     * @param stats    counters to update
     * @throws IOException if the file exists in the mirror but cannot be copied
     */
    void copy(String relative, CopyStats stats) throws IOException {
        String trimmed = relative;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        Path source = mirrorRoot.resolve(trimmed).normalize();
        Path target = destRoot.resolve(trimmed).normalize();

        if (trimmed.isEmpty() || !source.startsWith(mirrorRoot) || !target.startsWith(destRoot)) {
            log.warn("Refusing path outside the archive: {}", relative);
            stats.recordMissing();
            return;
        }
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            stats.recordSkipped();
            return;
        }
        if (!Files.isRegularFile(source)) {
            log.warn("{} not found", source);
            stats.recordMissing();
            return;
        }

        Files.createDirectories(target.getParent());
        if (symlink) {
            Files.createSymbolicLink(target, target.getParent().relativize(source));
            log.debug("Linked {}", trimmed);
        } else {
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
            log.debug("Copied {}", trimmed);
        }
        stats.recordCopied();
    }
}
