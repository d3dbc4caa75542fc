package com.largomodo.debpartial.core.domain;

import com.largomodo.debpartial.core.PartitionObserver;
import com.largomodo.debpartial.core.PartitionTooSmallException;
import com.largomodo.debpartial.index.PackageCatalog;
import com.largomodo.debpartial.index.SourceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Next-fit partitioner: a single left-to-right pass that never reorders packages and never
 * reopens a closed partition.
 * <p>
 * Greedy vs optimal tradeoff: packing density is traded for a stable, predictable package
 * order across partitions (the order usually encodes priority, e.g. popularity), O(n).
 * <p>
 * A package that does not fit closes the open partition and starts the next one. A package
 * that does not even fit an empty partition is an oversized singleton: skipped and reported
 * when oversized packages are ignored, fatal otherwise.
 */
public class GreedyPartitioner implements Partitioner {

    private static final Logger log = LoggerFactory.getLogger(GreedyPartitioner.class);

    private final PackageCatalog packages;
    private final SourceCatalog sources;
    private final PartitionOptions options;
    private final PartitionObserver observer;

    /**
     * @param packages package sizes
     * @param sources  source sizes and binary to source mapping, may be null only with
     *                 {@link SourceMode#NONE}
     * @param options  capacities, limit and policies
     * @param observer receives missing-source and skipped-package notifications
     */
    public GreedyPartitioner(PackageCatalog packages, SourceCatalog sources,
                             PartitionOptions options, PartitionObserver observer) {
        if (packages == null || options == null || observer == null) {
            throw new IllegalArgumentException("packages, options and observer cannot be null");
        }
        if (sources == null && options.sourceMode() != SourceMode.NONE) {
            throw new IllegalArgumentException("Source catalog required for source mode " + options.sourceMode());
        }
        this.packages = packages;
        this.sources = sources;
        this.options = options;
        this.observer = observer;
    }

    @Override
    public PartitionPlan partition(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("Package list cannot be null");
        }

        PartitionBudget budget = PartitionBudget.of(options.maxPartitions());
        // Opened first: its initial partition counts against the limit before any package partition
        SourcePartitionSequence sourceSequence = options.sourceMode() == SourceMode.SEPARATE
                ? new SourcePartitionSequence(options.sourceCapacities(), budget, sources)
                : null;
        PartitionSequence sequence = new PartitionSequence(options.packageCapacities(), budget);
        Set<String> chargedSources = new HashSet<>();
        List<String> skipped = new ArrayList<>();

        int left = 0;
        while (left < names.size()) {
            if (!sequence.open()) {
                break;
            }
            Partition partition = sequence.current();

            // Fill the open partition until the package at 'left' does not fit
            // Invariant: partition.size() <= partition.capacity()
            while (left < names.size()) {
                String name = names.get(left);
                boolean placed;
                try {
                    placed = place(name, partition, sourceSequence, chargedSources);
                } catch (PartitionTooSmallException e) {
                    if (!options.ignoreOversized()) {
                        throw e;
                    }
                    observer.onOversizedSkipped(name, e);
                    skipped.add(name);
                    left++;
                    continue;
                }
                if (!placed) {
                    break;
                }
                left++;
            }

            if (partition.isEmpty()) {
                // Only an exhausted source budget refuses the first package of a partition
                break;
            }
            log.debug("Partition {} closed: {} package(s), {} of {} bytes",
                    partition.index(), partition.items().size(), partition.size(), partition.capacity());
        }

        boolean truncated = left < names.size();
        if (truncated) {
            log.info("Partition limit {} reached: {} package(s) left unassigned, starting with '{}'",
                    options.maxPartitions(), names.size() - left, names.get(left));
        }

        return new PartitionPlan(options.sourceMode(),
                sequence.partitions(),
                sourceSequence == null ? List.of() : sourceSequence.partitions(),
                skipped,
                truncated);
    }

    /**
     * Tries to add a package (and account for its source) to the open partition.
     *
     * @return false if the partition has to be closed first
     * @throws PartitionTooSmallException if the partition is empty and still cannot take it
     */
    private boolean place(String name, Partition partition, SourcePartitionSequence sourceSequence,
                          Set<String> chargedSources) {
        long packageSize = packages.sizeOf(name);
        if (!partition.fits(packageSize)) {
            if (partition.isEmpty()) {
                throw new PartitionTooSmallException(PartitionTooSmallException.Item.PACKAGE,
                        name, packageSize, partition.capacity(), partition.index());
            }
            return false;
        }

        return switch (options.sourceMode()) {
            case SEPARATE -> placeWithSeparateSource(name, packageSize, partition, sourceSequence);
            case MERGE -> placeWithMergedSource(name, packageSize, partition, chargedSources);
            case NONE -> {
                partition.add(name, packageSize);
                yield true;
            }
        };
    }

    private boolean placeWithSeparateSource(String name, long packageSize, Partition partition,
                                            SourcePartitionSequence sourceSequence) {
        Optional<String> source = sources.sourceOf(name, observer);
        if (source.isPresent()) {
            SourcePartitionSequence.Placement placement;
            try {
                placement = sourceSequence.add(source.get());
            } catch (PartitionTooSmallException e) {
                // Surfaces as the first package of the next partition, where the policy applies
                if (partition.isEmpty()) {
                    throw e;
                }
                return false;
            }
            if (placement == SourcePartitionSequence.Placement.BUDGET_EXHAUSTED) {
                return false;
            }
        }
        partition.add(name, packageSize);
        return true;
    }

    private boolean placeWithMergedSource(String name, long packageSize, Partition partition,
                                          Set<String> chargedSources) {
        Optional<String> source = sources.sourceOf(name, observer);
        long sourceSize = source
                .filter(s -> !chargedSources.contains(s))
                .map(s -> sources.sizeOf(s))
                .orElse(0L);

        if (!partition.fits(packageSize + sourceSize)) {
            if (partition.isEmpty()) {
                throw new PartitionTooSmallException(PartitionTooSmallException.Item.PACKAGE_WITH_SOURCE,
                        name, packageSize + sourceSize, partition.capacity(), partition.index());
            }
            return false;
        }

        partition.add(name, packageSize);
        if (source.isPresent() && chargedSources.add(source.get())) {
            partition.charge(source.get(), sourceSize);
        }
        return true;
    }
}
