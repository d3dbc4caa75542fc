package com.largomodo.debpartial.core.domain;

import com.largomodo.debpartial.core.CapacitySequence;
import com.largomodo.debpartial.core.PartitionObserver;
import com.largomodo.debpartial.index.PackageCatalog;
import com.largomodo.debpartial.index.PackageRecord;
import com.largomodo.debpartial.index.SourceCatalog;
import com.largomodo.debpartial.index.SourceRecord;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based tests for GreedyPartitioner.
 * <p>
 * Tests verify, for package sizes never larger than the capacity:
 * - Partitions concatenate to the input order
 * - No partition exceeds its capacity
 * - Each partition is closed only by a package that does not fit it
 * - Repeated runs give the same plan
 * <p>
 * With sources, oversized packages ignored and a partition limit:
 * - Placed packages are the consumed input prefix minus skipped ones, the rest is truncated
 * - Package and source partitions together stay within the limit
 * - Every source is placed or charged at most once
 */
class GreedyPartitionerPropertyTest {

    @Provide
    Arbitrary<List<Long>> packageSizes() {
        return Arbitraries.longs().between(1, 100).list().ofMaxSize(60);
    }

    private static PackageCatalog catalog(List<Long> sizes) {
        PackageCatalog catalog = new PackageCatalog();
        for (int i = 0; i < sizes.size(); i++) {
            catalog.register(new PackageRecord("p" + i, sizes.get(i), "pool/p" + i + ".deb"));
        }
        return catalog;
    }

    private static List<String> names(List<Long> sizes) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < sizes.size(); i++) {
            names.add("p" + i);
        }
        return names;
    }

    private static PartitionPlan run(List<Long> sizes, long capacity) {
        PartitionOptions options = new PartitionOptions(CapacitySequence.of(capacity), null, 0, SourceMode.NONE, false);
        return new GreedyPartitioner(catalog(sizes), null, options, new PartitionObserver() {
        }).partition(names(sizes));
    }

    @Property
    void testPartitionsConcatenateToInputOrder(@ForAll("packageSizes") List<Long> sizes,
                                               @ForAll @LongRange(min = 100, max = 400) long capacity) {
        PartitionPlan plan = run(sizes, capacity);

        assertEquals(names(sizes), plan.placedPackages());
        assertFalse(plan.truncated());
        assertTrue(plan.skipped().isEmpty());
    }

    @Property
    void testCapacityNeverExceeded(@ForAll("packageSizes") List<Long> sizes,
                                   @ForAll @LongRange(min = 100, max = 400) long capacity) {
        for (Partition partition : run(sizes, capacity).packagePartitions()) {
            assertTrue(partition.size() <= partition.capacity(),
                    "Partition " + partition + " exceeds its capacity");
            assertFalse(partition.isEmpty());
        }
    }

    @Property
    void testPartitionClosedOnlyByPackageThatDoesNotFit(@ForAll("packageSizes") List<Long> sizes,
                                                        @ForAll @LongRange(min = 100, max = 400) long capacity) {
        PackageCatalog catalog = catalog(sizes);
        List<Partition> partitions = run(sizes, capacity).packagePartitions();

        for (int i = 0; i + 1 < partitions.size(); i++) {
            String next = partitions.get(i + 1).items().get(0);
            assertTrue(partitions.get(i).size() + catalog.sizeOf(next) > capacity,
                    "Package " + next + " would have fit into partition " + i);
        }
    }

    @Property
    void testRepeatedRunsGiveSamePlan(@ForAll("packageSizes") List<Long> sizes,
                                      @ForAll @LongRange(min = 100, max = 400) long capacity) {
        List<List<String>> first = new ArrayList<>();
        for (Partition partition : run(sizes, capacity).packagePartitions()) {
            first.add(partition.items());
        }
        List<List<String>> second = new ArrayList<>();
        for (Partition partition : run(sizes, capacity).packagePartitions()) {
            second.add(partition.items());
        }

        assertEquals(first, second);
    }

    @Provide
    Arbitrary<List<Long>> mixedPackageSizes() {
        return Arbitraries.longs().between(1, 150).list().ofMaxSize(40);
    }

    @Provide
    Arbitrary<List<Long>> sourceSizes() {
        return Arbitraries.longs().between(1, 120).list().ofMaxSize(10);
    }

    @Provide
    Arbitrary<SourceMode> sourceModes() {
        return Arbitraries.of(SourceMode.SEPARATE, SourceMode.MERGE);
    }

    // Package i is built from source s(i % sources), no sources means every source is missing
    private static SourceCatalog sourceCatalog(int packageCount, List<Long> sourceSizes) {
        SourceCatalog catalog = new SourceCatalog();
        for (int j = 0; j < sourceSizes.size(); j++) {
            List<String> binaries = new ArrayList<>();
            for (int i = j; i < packageCount; i += sourceSizes.size()) {
                binaries.add("p" + i);
            }
            catalog.register(new SourceRecord("s" + j, "pool/s" + j, binaries,
                    List.of(new SourceRecord.SourceFile("s" + j + ".dsc", sourceSizes.get(j)))));
        }
        return catalog;
    }

    private static PartitionPlan runWithSources(List<Long> sizes, List<Long> sourceSizes, SourceMode mode,
                                                long capacity, int maxPartitions) {
        PartitionOptions options = new PartitionOptions(CapacitySequence.of(capacity), null, maxPartitions, mode, true);
        return new GreedyPartitioner(catalog(sizes), sourceCatalog(sizes.size(), sourceSizes), options,
                new PartitionObserver() {
                }).partition(names(sizes));
    }

    @Property
    void testPlacedIsConsumedPrefixMinusSkipped(@ForAll("mixedPackageSizes") List<Long> sizes,
                                                @ForAll("sourceSizes") List<Long> sourceSizes,
                                                @ForAll("sourceModes") SourceMode mode,
                                                @ForAll @LongRange(min = 100, max = 200) long capacity,
                                                @ForAll @IntRange(min = 0, max = 6) int maxPartitions) {
        PartitionPlan plan = runWithSources(sizes, sourceSizes, mode, capacity, maxPartitions);
        List<String> input = names(sizes);
        Set<String> placed = new HashSet<>(plan.placedPackages());
        Set<String> skipped = new HashSet<>(plan.skipped());

        int consumed = 0;
        while (consumed < input.size()
                && (placed.contains(input.get(consumed)) || skipped.contains(input.get(consumed)))) {
            consumed++;
        }
        List<String> expectedPlaced = new ArrayList<>();
        List<String> expectedSkipped = new ArrayList<>();
        for (String name : input.subList(0, consumed)) {
            (skipped.contains(name) ? expectedSkipped : expectedPlaced).add(name);
        }

        assertEquals(expectedPlaced, plan.placedPackages());
        assertEquals(expectedSkipped, plan.skipped());
        assertEquals(consumed < input.size(), plan.truncated());
        if (maxPartitions == 0) {
            assertFalse(plan.truncated(), "Only a partition limit truncates the plan");
        }
    }

    @Property
    void testLimitSharedWithSourcePartitions(@ForAll("mixedPackageSizes") List<Long> sizes,
                                             @ForAll("sourceSizes") List<Long> sourceSizes,
                                             @ForAll("sourceModes") SourceMode mode,
                                             @ForAll @LongRange(min = 100, max = 200) long capacity,
                                             @ForAll @IntRange(min = 1, max = 6) int maxPartitions) {
        PartitionPlan plan = runWithSources(sizes, sourceSizes, mode, capacity, maxPartitions);

        assertTrue(plan.packagePartitions().size() + plan.sourcePartitions().size() <= maxPartitions,
                "Plan " + plan + " exceeds limit " + maxPartitions);
        if (mode == SourceMode.MERGE) {
            assertTrue(plan.sourcePartitions().isEmpty());
        }
    }

    @Property
    void testSourcesPlacedOnceWithinCapacity(@ForAll("mixedPackageSizes") List<Long> sizes,
                                             @ForAll("sourceSizes") List<Long> sourceSizes,
                                             @ForAll("sourceModes") SourceMode mode,
                                             @ForAll @LongRange(min = 100, max = 200) long capacity,
                                             @ForAll @IntRange(min = 0, max = 6) int maxPartitions) {
        PartitionPlan plan = runWithSources(sizes, sourceSizes, mode, capacity, maxPartitions);

        List<String> placedSources = new ArrayList<>();
        for (Partition partition : plan.packagePartitions()) {
            assertTrue(partition.size() <= partition.capacity(), "Partition " + partition + " exceeds its capacity");
            placedSources.addAll(partition.sources());
        }
        for (Partition partition : plan.sourcePartitions()) {
            assertTrue(partition.size() <= partition.capacity(), "Partition " + partition + " exceeds its capacity");
            placedSources.addAll(partition.items());
        }

        assertEquals(new HashSet<>(placedSources).size(), placedSources.size(),
                "Sources placed more than once: " + placedSources);
    }
}
