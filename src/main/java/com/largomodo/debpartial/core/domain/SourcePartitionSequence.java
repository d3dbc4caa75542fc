package com.largomodo.debpartial.core.domain;

import com.largomodo.debpartial.core.CapacitySequence;
import com.largomodo.debpartial.core.PartitionTooSmallException;
import com.largomodo.debpartial.index.SourceCatalog;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Source partitions kept apart from the package partitions.
 * <p>
 * Applies the same next-fit rule as the package side with its own capacity list. The first
 * source partition is opened on construction and counts against the shared budget from the
 * start. A source is placed at most once: later binaries of the same source find it
 * already placed, in whichever earlier partition that was.
 */
public class SourcePartitionSequence {

    /**
     * Outcome of offering a source to the sequence.
     */
    public enum Placement {
        PLACED,
        ALREADY_PLACED,
        BUDGET_EXHAUSTED
    }

    private final PartitionSequence sequence;
    private final SourceCatalog catalog;
    private final Set<String> placed = new HashSet<>();

    public SourcePartitionSequence(CapacitySequence capacities, PartitionBudget budget, SourceCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        this.sequence = new PartitionSequence(capacities, budget);
        this.catalog = catalog;
        sequence.open();
    }

    /**
     * Places a source into the open source partition, opening the next one when it is full.
     * Nothing changes when the source cannot be placed.
     *
     * @param source source package name
     * @return how the source was handled
     * @throws PartitionTooSmallException if the source alone exceeds the capacity of the
     *                                    partition it would have to start
     */
    public Placement add(String source) {
        if (placed.contains(source)) {
            return Placement.ALREADY_PLACED;
        }
        long size = catalog.sizeOf(source);
        Partition current = sequence.current();

        if (current != null) {
            if (current.fits(size)) {
                place(current, source, size);
                return Placement.PLACED;
            }
            if (current.isEmpty()) {
                throw new PartitionTooSmallException(PartitionTooSmallException.Item.SOURCE,
                        source, size, current.capacity(), current.index());
            }
        }

        long nextCapacity = sequence.nextCapacity();
        if (size > nextCapacity) {
            int nextIndex = current == null ? 0 : current.index() + 1;
            throw new PartitionTooSmallException(PartitionTooSmallException.Item.SOURCE,
                    source, size, nextCapacity, nextIndex);
        }
        if (!sequence.open()) {
            return Placement.BUDGET_EXHAUSTED;
        }
        place(sequence.current(), source, size);
        return Placement.PLACED;
    }

    private void place(Partition partition, String source, long size) {
        partition.add(source, size);
        placed.add(source);
    }

    public boolean contains(String source) {
        return placed.contains(source);
    }

    /**
     * @return non-empty source partitions in order
     */
    public List<Partition> partitions() {
        return sequence.partitions();
    }
}
