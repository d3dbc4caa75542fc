package com.largomodo.debpartial.service;

/**
 * Counters of one archive copy run. Not thread-safe.
 */
public class CopyStats {

    private int copied;
    private int skipped;
    private int missing;

    void recordCopied() {
        copied++;
    }

    void recordSkipped() {
        skipped++;
    }

    void recordMissing() {
        missing++;
    }

    /**
     * @return files copied or linked
     */
    public int getCopied() {
        return copied;
    }

    /**
     * @return files already present at the destination
     */
    public int getSkipped() {
        return skipped;
    }

    /**
     * @return referenced files absent from the mirror or outside the archive
     */
    public int getMissing() {
        return missing;
    }

    @Override
    public String toString() {
        return copied + " copied, " + skipped + " skipped, " + missing + " missing";
    }
}
