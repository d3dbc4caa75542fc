package com.largomodo.debpartial.core.domain;

import com.largomodo.debpartial.core.PartitionTooSmallException;

import java.util.List;

/**
 * Strategy interface for splitting an ordered package list into capacity-bounded partitions.
 */
public interface Partitioner {
    /**
     * Assigns packages to partitions, keeping their order.
     *
     * @param packages package names in the order they should be placed, must not be null
     * @return the plan, with no partitions if the list is empty
     * @throws IllegalArgumentException   if packages is null
     * @throws PartitionTooSmallException if a package (or its source) cannot fit alone and
     *                                    oversized packages are not ignored
     */
    PartitionPlan partition(List<String> packages);
}
