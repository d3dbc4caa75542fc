package com.largomodo.debpartial.core;

import com.largomodo.debpartial.index.PackageCatalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the ordered package list fed to the partitioner.
 * <p>
 * Explicit includes come first, then the names listed in the include file; the list is
 * authoritative as soon as it is non-empty. Otherwise every cataloged package is taken in
 * catalog order. A name listed twice keeps its first position.
 */
public final class PackageSelection {

    private PackageSelection() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param catalog     package catalog
     * @param includes    explicitly included names, unknown ones are reported and dropped
     * @param includeFrom file with one package name per line, unknown names silently
     *                    dropped; null if not given
     * @param observer    receives unknown explicit includes
     * @return package names in placement order
     * @throws IOException if the include file cannot be read
     */
    public static List<String> select(PackageCatalog catalog, List<String> includes, Path includeFrom,
                                      PartitionObserver observer) throws IOException {
        Set<String> selected = new LinkedHashSet<>();

        if (includes != null) {
            for (String name : includes) {
                if (catalog.contains(name)) {
                    selected.add(name);
                } else {
                    observer.onUnknownPackage(name);
                }
            }
        }

        if (includeFrom != null) {
            try (BufferedReader reader = Files.newBufferedReader(includeFrom, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String name = line.trim();
                    if (catalog.contains(name)) {
                        selected.add(name);
                    }
                }
            }
        }

        if (selected.isEmpty()) {
            return catalog.names();
        }
        return new ArrayList<>(selected);
    }
}
