package com.largomodo.debpartial.service;

import com.largomodo.debpartial.index.BinaryIndex;
import com.largomodo.debpartial.index.PackageCatalog;
import com.largomodo.debpartial.index.SourceCatalog;
import com.largomodo.debpartial.index.SourceIndex;

import java.util.Map;

/**
 * Catalogs and per-document indices of one source archive, read-only once loaded.
 *
 * @param packages      package sizes across all binary indices
 * @param sources       source sizes and mapping across all source indices (empty when
 *                      sources are not handled)
 * @param binaryIndices binary indices keyed by {@code dist/section/arch}
 * @param sourceIndices source indices keyed by {@code dist/section}
 */
public record LoadedArchive(PackageCatalog packages,
                            SourceCatalog sources,
                            Map<String, BinaryIndex> binaryIndices,
                            Map<String, SourceIndex> sourceIndices) {

    public LoadedArchive {
        binaryIndices = Map.copyOf(binaryIndices);
        sourceIndices = Map.copyOf(sourceIndices);
    }

    /**
     * @return the index, or null if it was not loaded
     */
    public BinaryIndex binaryIndex(String dist, String section, String arch) {
        return binaryIndices.get(ArchiveLayout.key(dist, section, arch));
    }

    /**
     * @return the index, or null if sources were not loaded
     */
    public SourceIndex sourceIndex(String dist, String section) {
        return sourceIndices.get(ArchiveLayout.key(dist, section));
    }
}
