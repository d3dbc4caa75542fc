package com.largomodo.debpartial.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One Packages index (one distribution, section and architecture).
 * <p>
 * Keeps each package's stanza so a partition's subset can be written back out, and feeds
 * every well-formed stanza into the shared {@link PackageCatalog}.
 */
public class BinaryIndex {

    private static final Logger log = LoggerFactory.getLogger(BinaryIndex.class);

    private final Path document;
    private final Map<String, Stanza> stanzas;

    private BinaryIndex(Path document, Map<String, Stanza> stanzas) {
        this.document = document;
        this.stanzas = stanzas;
    }

    /**
     * Parses a Packages index and registers its packages in the catalog.
     *
     * @param document Packages or Packages.gz file
     * @param catalog  catalog shared by all binary indices of the run
     * @return the parsed index
     * @throws IndexReadException if the document cannot be read
     */
    public static BinaryIndex load(Path document, PackageCatalog catalog) throws IndexReadException {
        Map<String, Stanza> stanzas = new LinkedHashMap<>();
        int skipped = 0;
        for (Stanza stanza : StanzaReader.read(document)) {
            String name = stanza.field("Package");
            if (name == null || name.isEmpty()) {
                skipped++;
                continue;
            }
            stanzas.put(name, stanza);
            var record = PackageRecord.fromStanza(stanza);
            if (record.isPresent()) {
                catalog.register(record.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("{}: {} stanza(s) without Package, Size or Filename", document, skipped);
        }
        return new BinaryIndex(document, stanzas);
    }

    /**
     * @param name package name
     * @return the package's stanza in this index, or null if it is not listed here
     */
    public Stanza stanzaOf(String name) {
        return stanzas.get(name);
    }

    public boolean contains(String name) {
        return stanzas.containsKey(name);
    }

    public Collection<String> names() {
        return stanzas.keySet();
    }

    public Path getDocument() {
        return document;
    }
}
