package com.largomodo.debpartial.core.domain;

import com.largomodo.debpartial.core.CapacitySequence;

/**
 * Partitioning parameters.
 *
 * @param packageCapacities capacities of the package partitions
 * @param sourceCapacities  capacities of the source partitions ({@link SourceMode#SEPARATE});
 *                          null means the package capacities
 * @param maxPartitions     maximum number of partitions overall, 0 for no limit
 * @param sourceMode        how sources are accounted for
 * @param ignoreOversized   skip (true) or abort on (false) a package that cannot fit alone
 */
public record PartitionOptions(CapacitySequence packageCapacities,
                               CapacitySequence sourceCapacities,
                               int maxPartitions,
                               SourceMode sourceMode,
                               boolean ignoreOversized) {

    public PartitionOptions {
        if (packageCapacities == null) {
            throw new IllegalArgumentException("packageCapacities cannot be null");
        }
        if (sourceMode == null) {
            throw new IllegalArgumentException("sourceMode cannot be null");
        }
        if (maxPartitions < 0) {
            throw new IllegalArgumentException("maxPartitions cannot be negative, got: " + maxPartitions);
        }
        if (sourceCapacities == null) {
            sourceCapacities = packageCapacities;
        }
    }

    /**
     * Separate source partitions with the same capacities, no limit, abort on oversized.
     *
     * @param capacities package and source capacities
     * @return default options
     */
    public static PartitionOptions defaults(CapacitySequence capacities) {
        return new PartitionOptions(capacities, null, 0, SourceMode.SEPARATE, false);
    }
}
