package com.largomodo.debpartial.core.domain;

import com.largomodo.debpartial.core.CapacitySequence;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of partitions, only the last of which is open for new items.
 * <p>
 * Partition {@code i} is created with {@code capacities.capacityAt(i)}; each creation claims
 * one unit of the shared {@link PartitionBudget}. Partitions are never revisited once a
 * later one is opened (next-fit).
 */
public class PartitionSequence {

    private final CapacitySequence capacities;
    private final PartitionBudget budget;
    private final List<Partition> partitions = new ArrayList<>();

    public PartitionSequence(CapacitySequence capacities, PartitionBudget budget) {
        if (capacities == null || budget == null) {
            throw new IllegalArgumentException("capacities and budget cannot be null");
        }
        this.capacities = capacities;
        this.budget = budget;
    }

    /**
     * Closes the current partition and opens the next one. An empty current partition is
     * kept open instead, so no empty partition is ever closed.
     *
     * @return true if a partition is open afterwards, false if the budget is exhausted
     */
    public boolean open() {
        Partition current = current();
        if (current != null && current.isEmpty()) {
            return true;
        }
        if (!budget.tryAcquire()) {
            return false;
        }
        int index = partitions.size();
        partitions.add(new Partition(index, capacities.capacityAt(index)));
        return true;
    }

    /**
     * @return the open partition, or null before the first {@link #open()}
     */
    public Partition current() {
        return partitions.isEmpty() ? null : partitions.get(partitions.size() - 1);
    }

    /**
     * @return capacity the next partition would be opened with
     */
    public long nextCapacity() {
        return capacities.capacityAt(partitions.size());
    }

    /**
     * @return non-empty partitions in order
     */
    public List<Partition> partitions() {
        List<Partition> filled = new ArrayList<>(partitions.size());
        for (Partition partition : partitions) {
            if (!partition.isEmpty()) {
                filled.add(partition);
            }
        }
        return List.copyOf(filled);
    }
}
