package com.largomodo.debpartial.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Debian archive layout: which distributions, sections and architectures are handled and
 * where their indices live under an archive root.
 * <pre>
 * &lt;root&gt;/dists/&lt;dist&gt;/&lt;section&gt;/binary-&lt;arch&gt;/Packages.gz
 * &lt;root&gt;/dists/&lt;dist&gt;/&lt;section&gt;/source/Sources.gz
 * </pre>
 *
 * @param dists    distributions, e.g. {@code unstable}
 * @param sections sections, e.g. {@code main}
 * @param arches   architectures, e.g. {@code i386}
 */
public record ArchiveLayout(List<String> dists, List<String> sections, List<String> arches) {

    public static final String DISTS = "dists";
    public static final String PACKAGES_INDEX = "Packages.gz";
    public static final String SOURCES_INDEX = "Sources.gz";

    public ArchiveLayout {
        if (dists == null || dists.isEmpty() || sections == null || sections.isEmpty()
                || arches == null || arches.isEmpty()) {
            throw new IllegalArgumentException("dists, sections and arches must not be empty");
        }
        dists = List.copyOf(dists);
        sections = List.copyOf(sections);
        arches = List.copyOf(arches);
    }

    public Path sectionDir(Path root, String dist, String section) {
        return root.resolve(DISTS).resolve(dist).resolve(section);
    }

    public Path packagesIndex(Path root, String dist, String section, String arch) {
        return sectionDir(root, dist, section).resolve("binary-" + arch).resolve(PACKAGES_INDEX);
    }

    public Path sourcesIndex(Path root, String dist, String section) {
        return sectionDir(root, dist, section).resolve("source").resolve(SOURCES_INDEX);
    }

    static String key(String dist, String section) {
        return dist + "/" + section;
    }

    static String key(String dist, String section, String arch) {
        return dist + "/" + section + "/" + arch;
    }
}
