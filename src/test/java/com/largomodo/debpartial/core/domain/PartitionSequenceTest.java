package com.largomodo.debpartial.core.domain;

import com.largomodo.debpartial.core.CapacitySequence;
import com.largomodo.debpartial.core.PartitionTooSmallException;
import com.largomodo.debpartial.index.SourceCatalog;
import com.largomodo.debpartial.index.SourceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PartitionSequenceTest {

    @Test
    void testOpenReusesEmptyPartition() {
        PartitionBudget budget = PartitionBudget.unlimited();
        PartitionSequence sequence = new PartitionSequence(CapacitySequence.of(10, 20), budget);

        assertNull(sequence.current());
        assertTrue(sequence.open());
        assertTrue(sequence.open());

        assertEquals(1, budget.used());
        assertEquals(0, sequence.current().index());
        assertEquals(10, sequence.current().capacity());
        assertEquals(20, sequence.nextCapacity());
        assertTrue(sequence.partitions().isEmpty(), "Empty partitions are not reported");
    }

    @Test
    void testBudgetLimitsOpenings() {
        PartitionBudget budget = PartitionBudget.of(1);
        PartitionSequence sequence = new PartitionSequence(CapacitySequence.of(10), budget);

        assertTrue(sequence.open());
        sequence.current().add("a", 5);
        assertFalse(sequence.open());
        assertTrue(budget.isExhausted());
        assertEquals(1, sequence.partitions().size());
    }

    @Test
    void testNegativeLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> PartitionBudget.of(-1));
        assertFalse(PartitionBudget.of(0).isExhausted());
    }

    @Test
    void testSourceSequenceOpensFirstPartitionEagerly() {
        PartitionBudget budget = PartitionBudget.of(3);
        new SourcePartitionSequence(CapacitySequence.of(100), budget, new SourceCatalog());

        assertEquals(1, budget.used());
    }

    @Test
    void testSourceSequencePlacement() {
        SourceCatalog catalog = new SourceCatalog();
        for (String name : List.of("s1", "s2", "s3")) {
            catalog.register(new SourceRecord(name, "pool/" + name, List.of(name + "-bin"),
                    List.of(new SourceRecord.SourceFile(name + ".dsc", 60))));
        }
        PartitionBudget budget = PartitionBudget.of(2);
        SourcePartitionSequence sequence = new SourcePartitionSequence(CapacitySequence.of(100), budget, catalog);

        assertEquals(SourcePartitionSequence.Placement.PLACED, sequence.add("s1"));
        assertEquals(SourcePartitionSequence.Placement.ALREADY_PLACED, sequence.add("s1"));
        assertEquals(SourcePartitionSequence.Placement.PLACED, sequence.add("s2"));
        assertEquals(SourcePartitionSequence.Placement.BUDGET_EXHAUSTED, sequence.add("s3"));

        assertTrue(sequence.contains("s2"));
        assertFalse(sequence.contains("s3"));
        assertEquals(2, sequence.partitions().size());
    }

    @Test
    void testSourceLargerThanNextCapacity() {
        SourceCatalog catalog = new SourceCatalog();
        catalog.register(new SourceRecord("small", "", List.of(), List.of(new SourceRecord.SourceFile("a", 40))));
        catalog.register(new SourceRecord("big", "", List.of(), List.of(new SourceRecord.SourceFile("b", 80))));
        SourcePartitionSequence sequence = new SourcePartitionSequence(
                CapacitySequence.of(100, 50), PartitionBudget.unlimited(), catalog);

        sequence.add("small");
        PartitionTooSmallException e = assertThrows(PartitionTooSmallException.class, () -> sequence.add("big"));

        assertEquals(50, e.getCapacity());
        assertEquals(1, e.getPartitionIndex());
        assertFalse(sequence.contains("big"));
    }
}
