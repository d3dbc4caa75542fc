package com.largomodo.debpartial.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated registry of binary package sizes across every parsed Packages index.
 * <p>
 * Dedup key is the package's {@code Filename}: an {@code Architecture: all} package listed by
 * several architecture indices points at a single .deb and is counted once, while the
 * per-architecture builds of a package (distinct files, all of which must be carried)
 * accumulate under the same name.
 * <p>
 * Populated while indices are parsed, read-only afterwards. Not thread-safe.
 */
public class PackageCatalog {

    // Insertion order is the "all packages" order
    private final Map<String, Long> sizes = new LinkedHashMap<>();
    private final Set<String> registeredFiles = new HashSet<>();

    /**
     * Counts a package's file toward its size unless that file was already counted.
     *
     * @param record parsed package
     * @return true if the file was new to this catalog
     */
    public boolean register(PackageRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (!registeredFiles.add(record.filename())) {
            return false;
        }
        sizes.merge(record.name(), record.size(), Long::sum);
        return true;
    }

    /**
     * @param name package name
     * @return total size of the package's distinct files, 0 if unknown
     */
    public long sizeOf(String name) {
        return sizes.getOrDefault(name, 0L);
    }

    /**
     * @param names package names, unknown names count as 0
     * @return aggregate size
     */
    public long sizeOf(Collection<String> names) {
        long total = 0;
        for (String name : names) {
            total += sizeOf(name);
        }
        return total;
    }

    public boolean contains(String name) {
        return sizes.containsKey(name);
    }

    /**
     * @return all package names in the order they were first parsed
     */
    public List<String> names() {
        return new ArrayList<>(sizes.keySet());
    }

    public int size() {
        return sizes.size();
    }
}
