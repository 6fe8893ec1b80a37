package com.libragraph.nsm.core.archive;

/**
 * @param substring  scan decoded content for the raw query even when the
 *                   search index could answer it
 * @param maxResults result cap; the scan stops once it is reached
 */
public record SearchOptions(boolean substring, int maxResults) {

    public static final int DEFAULT_MAX_RESULTS = 100;

    public SearchOptions {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be >= 1, got: " + maxResults);
        }
    }

    public static SearchOptions defaults() {
        return new SearchOptions(false, DEFAULT_MAX_RESULTS);
    }
}
