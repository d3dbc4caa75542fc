package com.largomodo.debpartial.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable result of a partitioning pass, handed to the emitter.
 *
 * @param sourceMode        source accounting the plan was built with
 * @param packagePartitions package partitions in order, never empty ones
 * @param sourcePartitions  source partitions in order ({@link SourceMode#SEPARATE} only)
 * @param skipped           packages skipped as oversized under the ignore policy
 * @param truncated         true if the partition limit stopped the pass before the end of
 *                          the package list
 */
public record PartitionPlan(SourceMode sourceMode,
                            List<Partition> packagePartitions,
                            List<Partition> sourcePartitions,
                            List<String> skipped,
                            boolean truncated) {

    public PartitionPlan {
        packagePartitions = List.copyOf(packagePartitions);
        sourcePartitions = List.copyOf(sourcePartitions);
        skipped = List.copyOf(skipped);
    }

    /**
     * @return every placed package, partition by partition
     */
    public List<String> placedPackages() {
        List<String> placed = new ArrayList<>();
        for (Partition partition : packagePartitions) {
            placed.addAll(partition.items());
        }
        return placed;
    }
}
