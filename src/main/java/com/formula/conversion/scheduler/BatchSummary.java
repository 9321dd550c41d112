package com.formula.conversion.scheduler;

/**
 * Counts of a completed batch.
 *
 * @param totalFormulas formulas submitted
 * @param cacheHits     formulas already present in the image cache
 * @param duplicates    formulas identical to an earlier formula of the same batch
 * @param converted     formulas rendered in this batch
 */
public record BatchSummary(int totalFormulas, int cacheHits, int duplicates, int converted) {

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, 0);
    }
}
