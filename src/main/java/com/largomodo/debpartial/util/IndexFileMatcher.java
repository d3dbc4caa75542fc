package com.largomodo.debpartial.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Recognizes Debian index files in a partition tree, compressed or not.
 */
public class IndexFileMatcher {

    private static final Set<String> PACKAGES_NAMES = Set.of("Packages.gz", "Packages");
    private static final Set<String> SOURCES_NAMES = Set.of("Sources.gz", "Sources");

    private IndexFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param path file path to check (can be null)
     * @return true if path is a regular file named like a Packages index
     */
    public static boolean isPackagesIndex(Path path) {
        return matches(path, PACKAGES_NAMES);
    }

    /**
     * @param path file path to check (can be null)
     * @return true if path is a regular file named like a Sources index
     */
    public static boolean isSourcesIndex(Path path) {
        return matches(path, SOURCES_NAMES);
    }

    private static boolean matches(Path path, Set<String> names) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        // A directory called "Packages" is not an index
        if (!Files.isRegularFile(path)) {
            return false;
        }
        return names.contains(path.getFileName().toString());
    }
}
