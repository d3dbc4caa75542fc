package com.largomodo.debpartial.index;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when an index document cannot be opened, decompressed or read at all.
 * <p>
 * Malformed individual stanzas never raise this: they are tolerated by the parsers.
 */
public class IndexReadException extends IOException {

    private final Path document;

    public IndexReadException(Path document, Throwable cause) {
        super("Cannot read index " + document + ": " + cause.getMessage(), cause);
        this.document = document;
    }

    public Path getDocument() {
        return document;
    }
}
