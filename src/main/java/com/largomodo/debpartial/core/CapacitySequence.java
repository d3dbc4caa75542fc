package com.largomodo.debpartial.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered per-partition capacity list with carry-forward semantics.
 * <p>
 * Partition {@code i} gets {@code capacities[min(i, size - 1)]}: once the explicit list is
 * exhausted its last value applies to every further partition. Each entry is either a
 * literal byte count or a {@link MediaType} alias. A literal {@code 0} inherits the nearest
 * earlier non-zero entry (or stays 0 when there is none), so {@code 0} can be used as a
 * "same as before" placeholder.
 * <p>
 * Immutable once constructed.
 */
public final class CapacitySequence {

    private static final Pattern LITERAL = Pattern.compile("\\d+");

    private final List<String> entries;
    private final long[] capacities;

    private CapacitySequence(List<String> entries, long[] capacities) {
        this.entries = List.copyOf(entries);
        this.capacities = capacities;
    }

    /**
     * Builds a sequence from raw entries, resolving unknown aliases to 0 with a warning.
     *
     * @param entries literal byte counts and/or media aliases, not empty
     * @return resolved sequence
     * @throws IllegalArgumentException if entries is null or empty, or a literal overflows
     */
    public static CapacitySequence of(List<String> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Capacity list must not be empty");
        }
        long[] resolved = new long[entries.size()];
        long previous = 0;
        for (int i = 0; i < entries.size(); i++) {
            String entry = entries.get(i).trim();
            long capacity;
            if (LITERAL.matcher(entry).matches()) {
                capacity = parseLiteral(entry);
                if (capacity == 0) {
                    capacity = previous;
                }
            } else {
                capacity = MediaType.resolve(entry);
            }
            resolved[i] = capacity;
            if (capacity != 0) {
                previous = capacity;
            }
        }
        return new CapacitySequence(entries, resolved);
    }

    /**
     * Builds a sequence from literal byte counts.
     *
     * @param capacities byte counts, at least one
     * @return resolved sequence
     */
    public static CapacitySequence of(long... capacities) {
        if (capacities == null || capacities.length == 0) {
            throw new IllegalArgumentException("Capacity list must not be empty");
        }
        List<String> entries = new ArrayList<>(capacities.length);
        for (long capacity : capacities) {
            if (capacity < 0) {
                throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
            }
            entries.add(Long.toString(capacity));
        }
        return of(entries);
    }

    /**
     * Parses a comma separated capacity list, rejecting entries that are neither a plain
     * integer nor a known media alias.
     *
     * @param csv list such as {@code CD74,DVD,400000000}
     * @return resolved sequence
     * @throws IllegalArgumentException naming the first invalid entry
     */
    public static CapacitySequence parse(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new IllegalArgumentException("Capacity list must not be empty");
        }
        List<String> entries = new ArrayList<>();
        for (String raw : csv.split(",")) {
            String entry = raw.trim();
            if (!isValidEntry(entry)) {
                throw new IllegalArgumentException("Unknown media type " + entry +
                        " (use a byte count or one of: " + MediaType.supportedAliases() + ")");
            }
            entries.add(entry);
        }
        return of(entries);
    }

    /**
     * @param entry a single capacity entry
     * @return true if the entry is a representable byte count or a known media alias
     */
    public static boolean isValidEntry(String entry) {
        if (entry == null || entry.isEmpty()) {
            return false;
        }
        if (LITERAL.matcher(entry).matches()) {
            try {
                Long.parseLong(entry);
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return MediaType.fromAlias(entry).isPresent();
    }

    private static long parseLiteral(String entry) {
        try {
            return Long.parseLong(entry);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Capacity out of range: " + entry, e);
        }
    }

    /**
     * Capacity of the partition at the given index, carrying the last entry forward.
     *
     * @param index zero-based partition index
     * @return capacity in bytes
     */
    public long capacityAt(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Partition index cannot be negative: " + index);
        }
        return capacities[Math.min(index, capacities.length - 1)];
    }

    public int size() {
        return capacities.length;
    }

    public List<String> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return String.join(",", entries) + " " + Arrays.toString(capacities);
    }
}
