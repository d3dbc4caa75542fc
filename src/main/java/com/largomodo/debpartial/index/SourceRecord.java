package com.largomodo.debpartial.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A source package as listed by one stanza of a Sources index.
 *
 * @param name      source package name
 * @param directory archive-relative directory holding the source files, empty if unknown
 * @param binaries  binary packages built from this source
 * @param files     files of the source package (.dsc, .orig.tar.*, .debian.tar.* ...)
 */
public record SourceRecord(String name, String directory, List<String> binaries, List<SourceFile> files) {

    // At most 18 digits so the value always fits a long
    private static final Pattern SIZE = Pattern.compile("\\d{1,18}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * One {@code <checksum> <size> <name>} line of the source file list.
     *
     * @param name file name, relative to the source directory
     * @param size file size in bytes
     */
    public record SourceFile(String name, long size) {
    }

    public SourceRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        directory = directory == null ? "" : directory;
        binaries = List.copyOf(binaries);
        files = List.copyOf(files);
    }

    /**
     * @return sum of the sizes of all listed files
     */
    public long size() {
        long total = 0;
        for (SourceFile file : files) {
            total += file.size();
        }
        return total;
    }

    /**
     * @param file one of this record's files
     * @return archive-relative path, {@code directory/name}, used as the dedup key across builds
     */
    public String pathOf(SourceFile file) {
        return directory + "/" + file.name();
    }

    /**
     * Extracts a record from a Sources stanza.
     * <p>
     * Only Package is required. A missing Binary or Directory field leaves the record without
     * binaries or directory; file lines that do not read {@code <checksum> <size> <name>} are
     * skipped. The MD5 {@code Files} list is used, {@code Checksums-Sha256} when it is absent.
     *
     * @param stanza parsed stanza
     * @return the record, or empty when Package is missing
     */
    public static Optional<SourceRecord> fromStanza(Stanza stanza) {
        String name = stanza.field("Package");
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }

        List<String> binaries = new ArrayList<>();
        // Binary may be folded over several lines for sources with many binaries
        for (String line : stanza.lines("Binary")) {
            for (String binary : line.split(",")) {
                String trimmed = binary.trim();
                if (!trimmed.isEmpty()) {
                    binaries.add(trimmed);
                }
            }
        }

        List<String> fileLines = stanza.has("Files") ? stanza.lines("Files") : stanza.lines("Checksums-Sha256");
        List<SourceFile> files = new ArrayList<>();
        for (String line : fileLines) {
            String[] tokens = WHITESPACE.split(line.trim());
            if (tokens.length < 3 || !SIZE.matcher(tokens[1]).matches()) {
                continue;
            }
            files.add(new SourceFile(tokens[2], Long.parseLong(tokens[1])));
        }

        return Optional.of(new SourceRecord(name, stanza.field("Directory"), binaries, files));
    }
}
