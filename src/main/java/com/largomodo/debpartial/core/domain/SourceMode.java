package com.largomodo.debpartial.core.domain;

/**
 * How source packages are accounted for while partitioning.
 */
public enum SourceMode {
    // Sources go to their own partition sequence with its own capacities
    SEPARATE,
    // A source is charged into the partition of the first binary built from it
    MERGE,
    // Sources are not handled at all
    NONE
}
