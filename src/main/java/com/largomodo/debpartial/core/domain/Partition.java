package com.largomodo.debpartial.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One output unit (one disc worth) of the archive.
 * <p>
 * Holds the ordered item names assigned to it (packages, or sources in a source partition)
 * and, in merge mode, the sources charged into the same capacity. Filled only by the
 * partitioner while it is the open partition of its sequence; the accessors return
 * read-only views.
 */
public final class Partition {

    private final int index;
    private final long capacity;
    private final List<String> items = new ArrayList<>();
    private final List<String> sources = new ArrayList<>();
    private long itemSize;
    private long sourceSize;

    Partition(int index, long capacity) {
        this.index = index;
        this.capacity = capacity;
    }

    /**
     * @param bytes additional payload
     * @return true if the payload fits in the remaining capacity
     */
    boolean fits(long bytes) {
        return size() + bytes <= capacity;
    }

    void add(String item, long bytes) {
        items.add(item);
        itemSize += bytes;
    }

    void charge(String source, long bytes) {
        sources.add(source);
        sourceSize += bytes;
    }

    public int index() {
        return index;
    }

    public long capacity() {
        return capacity;
    }

    /**
     * @return item names in placement order
     */
    public List<String> items() {
        return Collections.unmodifiableList(items);
    }

    /**
     * @return sources charged into this partition (merge mode only), in placement order
     */
    public List<String> sources() {
        return Collections.unmodifiableList(sources);
    }

    public long itemSize() {
        return itemSize;
    }

    public long sourceSize() {
        return sourceSize;
    }

    /**
     * @return total payload: items plus charged sources
     */
    public long size() {
        return itemSize + sourceSize;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String toString() {
        return "Partition[" + index + ", " + size() + "/" + capacity + " bytes, " + items + "]";
    }
}
