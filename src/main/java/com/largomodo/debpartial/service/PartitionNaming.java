package com.largomodo.debpartial.service;

import java.util.List;

/**
 * Names of the top-level partition directories under the destination root.
 * <p>
 * Partition {@code i} is called {@code dirMap[i]} when the map has such an entry, {@code i}
 * otherwise, and is prefixed with the package or source prefix. When both prefixes are equal,
 * source partitions continue the numbering after the last package partition so the two
 * sequences never share a directory.
 *
 * @param dirMap       optional names per partition index
 * @param prefix       prefix of package partitions, e.g. {@code Debian}
 * @param sourcePrefix prefix of source partitions, e.g. {@code Debian-Src}
 */
public record PartitionNaming(List<String> dirMap, String prefix, String sourcePrefix) {

    public PartitionNaming {
        dirMap = dirMap == null ? List.of() : List.copyOf(dirMap);
        if (prefix == null || sourcePrefix == null) {
            throw new IllegalArgumentException("prefixes cannot be null");
        }
    }

    /**
     * @param index partition index
     * @return mapped name, or the index itself
     */
    public String name(int index) {
        return index < dirMap.size() ? dirMap.get(index) : String.valueOf(index);
    }

    public String packageDir(int index) {
        return prefix + name(index);
    }

    /**
     * @param index                  source partition index
     * @param packagePartitionCount  number of package partitions of the plan
     * @return directory name of the source partition
     */
    public String sourceDir(int index, int packagePartitionCount) {
        int named = prefix.equals(sourcePrefix) ? packagePartitionCount + index : index;
        return sourcePrefix + name(named);
    }
}
