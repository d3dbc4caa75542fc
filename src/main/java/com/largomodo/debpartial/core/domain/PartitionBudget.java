package com.largomodo.debpartial.core.domain;

/**
 * Upper bound on the total number of partitions a run may open.
 * <p>
 * Shared by the package sequence and, when sources live in partitions of their own, the
 * source sequence: together they never open more than {@code max} partitions.
 */
public final class PartitionBudget {

    private final int max;
    private int used;

    private PartitionBudget(int max) {
        this.max = max;
    }

    /**
     * @param max maximum number of partitions, 0 for no limit
     * @return fresh budget
     */
    public static PartitionBudget of(int max) {
        if (max < 0) {
            throw new IllegalArgumentException("Partition limit cannot be negative: " + max);
        }
        return new PartitionBudget(max);
    }

    public static PartitionBudget unlimited() {
        return new PartitionBudget(0);
    }

    /**
     * Claims one partition if the limit allows it.
     *
     * @return true if a partition may be opened
     */
    public boolean tryAcquire() {
        if (isExhausted()) {
            return false;
        }
        used++;
        return true;
    }

    public boolean isExhausted() {
        return max != 0 && used >= max;
    }

    public int used() {
        return used;
    }

    public int max() {
        return max;
    }
}
