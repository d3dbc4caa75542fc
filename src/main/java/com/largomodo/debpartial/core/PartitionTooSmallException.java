package com.largomodo.debpartial.core;

/**
 * Thrown when a single package or source alone exceeds the capacity of the partition it
 * has to start.
 * <p>
 * RuntimeException: the partitioner either skips the item (ignore-oversized policy) or
 * lets the exception abort the whole run. Follows CleanupException pattern for unchecked
 * exceptional conditions.
 */
public class PartitionTooSmallException extends RuntimeException {

    /**
     * What could not be placed.
     */
    public enum Item {
        PACKAGE("package"),
        SOURCE("source"),
        PACKAGE_WITH_SOURCE("package/source");

        private final String label;

        Item(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Item item;
    private final String itemName;
    private final long itemSize;
    private final long capacity;
    private final int partitionIndex;

    /**
     * @param item           kind of item that did not fit
     * @param itemName       package or source name
     * @param itemSize       size of the item in bytes (package plus source size for
     *                       {@link Item#PACKAGE_WITH_SOURCE})
     * @param capacity       capacity of the partition it had to start
     * @param partitionIndex index of that partition in its sequence
     */
    public PartitionTooSmallException(Item item, String itemName, long itemSize, long capacity, int partitionIndex) {
        super("Size '" + capacity + "' is too small to locate " + item.getLabel() + " '" + itemName +
                "' in partition " + partitionIndex + ": size '" + itemSize + "'");
        this.item = item;
        this.itemName = itemName;
        this.itemSize = itemSize;
        this.capacity = capacity;
        this.partitionIndex = partitionIndex;
    }

    public Item getItem() {
        return item;
    }

    public String getItemName() {
        return itemName;
    }

    public long getItemSize() {
        return itemSize;
    }

    public long getCapacity() {
        return capacity;
    }

    public int getPartitionIndex() {
        return partitionIndex;
    }
}
