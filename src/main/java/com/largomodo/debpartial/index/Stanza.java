package com.largomodo.debpartial.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One paragraph of a Packages or Sources index: {@code Field: value} lines, where lines
 * starting with whitespace continue the previous field.
 * <p>
 * Keeps the raw text so subsets of an index can be written back out unchanged.
 * Field names are case-insensitive.
 */
public final class Stanza {

    private final String text;
    private final Map<String, List<String>> fields;

    private Stanza(String text, Map<String, List<String>> fields) {
        this.text = text;
        this.fields = fields;
    }

    /**
     * Parses the lines of a single stanza. Lines that are neither a field nor a continuation
     * are kept in the raw text but otherwise ignored.
     *
     * @param lines stanza lines without line terminators, no blank lines
     * @return parsed stanza
     */
    public static Stanza parse(List<String> lines) {
        Map<String, List<String>> fields = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        StringBuilder text = new StringBuilder();
        List<String> current = null;

        for (String line : lines) {
            text.append(line).append('\n');
            if (line.startsWith(" ") || line.startsWith("\t")) {
                if (current != null) {
                    current.add(line.trim());
                }
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                current = null;
                continue;
            }
            current = new ArrayList<>();
            current.add(line.substring(colon + 1).trim());
            fields.put(line.substring(0, colon).trim(), current);
        }
        return new Stanza(text.toString(), fields);
    }

    /**
     * @param name field name
     * @return value on the field's first line, or null if the field is absent
     */
    public String field(String name) {
        List<String> values = fields.get(name);
        return values == null ? null : values.get(0);
    }

    /**
     * All lines of a field: the first-line value followed by each continuation line,
     * trimmed, with empty lines (such as the empty first line of {@code Files:}) dropped.
     *
     * @param name field name
     * @return field lines, empty if the field is absent
     */
    public List<String> lines(String name) {
        List<String> values = fields.get(name);
        if (values == null) {
            return Collections.emptyList();
        }
        List<String> nonEmpty = new ArrayList<>(values.size());
        for (String value : values) {
            if (!value.isEmpty()) {
                nonEmpty.add(value);
            }
        }
        return nonEmpty;
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    /**
     * @return raw stanza text, every line terminated by {@code \n}, no trailing blank line
     */
    public String text() {
        return text;
    }
}
