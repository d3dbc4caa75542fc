package com.largomodo.debpartial.index;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A binary package as listed by one stanza of a Packages index.
 *
 * @param name     package name
 * @param size     size of the .deb in bytes
 * @param filename archive-relative path of the .deb, used as the dedup key across builds
 */
public record PackageRecord(String name, long size, String filename) {

    // At most 18 digits so the value always fits a long
    private static final Pattern SIZE = Pattern.compile("\\d{1,18}");

    public PackageRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename must not be null or blank");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative, got: " + size);
        }
    }

    /**
     * Extracts a record from a Packages stanza.
     *
     * @param stanza parsed stanza
     * @return the record, or empty when Package, Size or Filename is missing or malformed
     */
    public static Optional<PackageRecord> fromStanza(Stanza stanza) {
        String name = stanza.field("Package");
        String size = stanza.field("Size");
        String filename = stanza.field("Filename");
        if (name == null || name.isEmpty() || filename == null || filename.isEmpty()
                || size == null || !SIZE.matcher(size).matches()) {
            return Optional.empty();
        }
        return Optional.of(new PackageRecord(name, Long.parseLong(size), filename));
    }
}
