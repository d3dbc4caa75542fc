package com.largomodo.debpartial.index;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One Sources index (one distribution and section).
 * <p>
 * Keeps each source's stanza for emission and registers every source in the shared
 * {@link SourceCatalog}.
 */
public class SourceIndex {

    private final Path document;
    private final Map<String, Stanza> stanzas;

    private SourceIndex(Path document, Map<String, Stanza> stanzas) {
        this.document = document;
        this.stanzas = stanzas;
    }

    /**
     * Parses a Sources index and registers its sources in the catalog.
     *
     * @param document Sources or Sources.gz file
     * @param catalog  catalog shared by all source indices of the run
     * @return the parsed index
     * @throws IndexReadException if the document cannot be read
     */
    public static SourceIndex load(Path document, SourceCatalog catalog) throws IndexReadException {
        Map<String, Stanza> stanzas = new LinkedHashMap<>();
        for (Stanza stanza : StanzaReader.read(document)) {
            SourceRecord.fromStanza(stanza).ifPresent(record -> {
                stanzas.put(record.name(), stanza);
                catalog.register(record);
            });
        }
        return new SourceIndex(document, stanzas);
    }

    /**
     * @param source source name
     * @return the source's stanza in this index, or null if it is not listed here
     */
    public Stanza stanzaOf(String source) {
        return stanzas.get(source);
    }

    public boolean contains(String source) {
        return stanzas.containsKey(source);
    }

    public Collection<String> names() {
        return stanzas.keySet();
    }

    public Path getDocument() {
        return document;
    }
}
