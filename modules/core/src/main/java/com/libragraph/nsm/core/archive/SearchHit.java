package com.libragraph.nsm.core.archive;

import java.util.Comparator;

/**
 * One matching entry.
 *
 * @param matches number of matches in the entry
 * @param size    uncompressed size of the entry
 */
public record SearchHit(String path, long matches, long size) {

    /** Densest first, then by path. */
    public static final Comparator<SearchHit> RANKING = Comparator
            .comparingDouble(SearchHit::density).reversed()
            .thenComparing(SearchHit::path);

    public double density() {
        return (double) matches / Math.max(1, size);
    }
}
