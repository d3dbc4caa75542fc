package com.largomodo.debpartial.index;

import com.largomodo.debpartial.core.PartitionObserver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Deduplicated registry of source package sizes and of the binary -> source mapping
 * across every parsed Sources index.
 * <p>
 * Dedup key is {@code Directory/filename}: the same source file listed by several
 * distributions or sections is counted once. Lookups for binaries whose source was never
 * seen are reported once per binary over the catalog's lifetime.
 * <p>
 * Populated while indices are parsed, read-only afterwards (apart from the missing-source
 * bookkeeping). Not thread-safe.
 */
public class SourceCatalog {

    private final Map<String, Long> sizes = new LinkedHashMap<>();
    private final Map<String, String> sourceByBinary = new HashMap<>();
    private final Set<String> registeredFiles = new HashSet<>();
    private final Set<String> reportedMissing = new HashSet<>();

    /**
     * Registers a source: maps each of its binaries to it and counts every file not already
     * counted toward its size. A binary listed by two sources maps to the last one registered.
     *
     * @param record parsed source
     */
    public void register(SourceRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        for (String binary : record.binaries()) {
            sourceByBinary.put(binary, record.name());
        }
        sizes.putIfAbsent(record.name(), 0L);
        for (SourceRecord.SourceFile file : record.files()) {
            if (registeredFiles.add(record.pathOf(file))) {
                sizes.merge(record.name(), file.size(), Long::sum);
            }
        }
    }

    /**
     * @param source source package name
     * @return total size of the source's distinct files, 0 if unknown
     */
    public long sizeOf(String source) {
        return sizes.getOrDefault(source, 0L);
    }

    /**
     * @param sources source names, unknown names count as 0
     * @return aggregate size
     */
    public long sizeOf(Collection<String> sources) {
        long total = 0;
        for (String source : sources) {
            total += sizeOf(source);
        }
        return total;
    }

    /**
     * Looks up the source a binary was built from.
     *
     * @param binary   binary package name
     * @param observer notified if the binary has no known source, at most once per binary
     * @return the source name, or empty if none was observed
     */
    public Optional<String> sourceOf(String binary, PartitionObserver observer) {
        String source = sourceByBinary.get(binary);
        if (source == null) {
            if (reportedMissing.add(binary)) {
                observer.onMissingSource(binary);
            }
            return Optional.empty();
        }
        return Optional.of(source);
    }

    /**
     * Resolves the distinct sources of a list of binaries.
     *
     * @param binaries binary package names
     * @param observer notified for binaries without a known source, at most once per binary
     * @return distinct source names in order of first appearance
     */
    public List<String> sourcesOf(Collection<String> binaries, PartitionObserver observer) {
        Set<String> sources = new LinkedHashSet<>();
        for (String binary : binaries) {
            sourceOf(binary, observer).ifPresent(sources::add);
        }
        return new ArrayList<>(sources);
    }

    public boolean contains(String source) {
        return sizes.containsKey(source);
    }

    public int size() {
        return sizes.size();
    }
}
