package com.largomodo.debpartial.service;

import com.largomodo.debpartial.index.BinaryIndex;
import com.largomodo.debpartial.index.IndexReadException;
import com.largomodo.debpartial.index.PackageCatalog;
import com.largomodo.debpartial.index.SourceCatalog;
import com.largomodo.debpartial.index.SourceIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads every Packages and Sources index named by the layout into fresh catalogs.
 * <p>
 * Binary indices are read architecture first, then distribution, then section; this order
 * fixes the catalog order used when no package list is given. Any unreadable index aborts
 * the load before anything is written.
 */
public class ArchiveLoader {

    private static final Logger log = LoggerFactory.getLogger(ArchiveLoader.class);

    private final ArchiveLayout layout;

    public ArchiveLoader(ArchiveLayout layout) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        this.layout = layout;
    }

    /**
     * @param root        top directory of the archive
     * @param withSources whether Sources indices are read
     * @return loaded catalogs and indices
     * @throws IndexReadException if any index cannot be read
     */
    public LoadedArchive load(Path root, boolean withSources) throws IndexReadException {
        PackageCatalog packages = new PackageCatalog();
        SourceCatalog sources = new SourceCatalog();
        Map<String, BinaryIndex> binaryIndices = new HashMap<>();
        Map<String, SourceIndex> sourceIndices = new HashMap<>();

        for (String arch : layout.arches()) {
            for (String dist : layout.dists()) {
                for (String section : layout.sections()) {
                    Path document = layout.packagesIndex(root, dist, section, arch);
                    log.info("Reading {}", root.relativize(document));
                    binaryIndices.put(ArchiveLayout.key(dist, section, arch), BinaryIndex.load(document, packages));
                }
            }
        }

        if (withSources) {
            for (String dist : layout.dists()) {
                for (String section : layout.sections()) {
                    Path document = layout.sourcesIndex(root, dist, section);
                    log.info("Reading {}", root.relativize(document));
                    sourceIndices.put(ArchiveLayout.key(dist, section), SourceIndex.load(document, sources));
                }
            }
        }

        log.info("Loaded {} package(s) and {} source(s)", packages.size(), sources.size());
        return new LoadedArchive(packages, sources, binaryIndices, sourceIndices);
    }
}
