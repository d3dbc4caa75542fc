package com.largomodo.debpartial.index;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Splits an index document into stanzas separated by blank lines.
 * <p>
 * Accepts gzip-compressed (detected by magic number, not by file name) and plain documents.
 * A final stanza without a trailing blank line is still returned.
 */
public final class StanzaReader {

    /**
     * Charset used to read and write index text. ISO-8859-1 maps every byte to one char, so
     * stanzas written back out are byte-identical to the document they were read from.
     */
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    private static final int GZIP_MAGIC_1 = 0x1f;
    private static final int GZIP_MAGIC_2 = 0x8b;

    private StanzaReader() {
        // Static utility class - prevent instantiation
    }

    /**
     * Reads all stanzas of an index file.
     *
     * @param document Packages/Sources file, gzip-compressed or plain
     * @return stanzas in document order
     * @throws IndexReadException if the file cannot be opened, decompressed or read
     */
    public static List<Stanza> read(Path document) throws IndexReadException {
        try (InputStream in = Files.newInputStream(document)) {
            return read(in);
        } catch (IOException e) {
            throw new IndexReadException(document, e);
        }
    }

    /**
     * Reads all stanzas from a stream. The stream is not closed.
     *
     * @param in gzip-compressed or plain stanza document
     * @return stanzas in document order
     * @throws IOException if the stream cannot be decompressed or read
     */
    public static List<Stanza> read(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(decompressIfNeeded(in), CHARSET));
        List<Stanza> stanzas = new ArrayList<>();
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                if (!lines.isEmpty()) {
                    stanzas.add(Stanza.parse(lines));
                    lines = new ArrayList<>();
                }
            } else {
                lines.add(line);
            }
        }
        if (!lines.isEmpty()) {
            stanzas.add(Stanza.parse(lines));
        }
        return stanzas;
    }

    private static InputStream decompressIfNeeded(InputStream in) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(in);
        buffered.mark(2);
        int first = buffered.read();
        int second = buffered.read();
        buffered.reset();
        if (first == GZIP_MAGIC_1 && second == GZIP_MAGIC_2) {
            return new GZIPInputStream(buffered);
        }
        return buffered;
    }
}
