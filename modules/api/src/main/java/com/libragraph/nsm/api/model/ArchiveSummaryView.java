package com.libragraph.nsm.api.model;

import com.libragraph.nsm.core.archive.ArchiveSummary;

public record ArchiveSummaryView(
        String output,
        int entryCount,
        long totalUncompressed,
        long dataBlockLength,
        long archiveSize,
        String compression,
        boolean encrypted,
        int searchTokenCount,
        int tokensRemaining
) {
    public static ArchiveSummaryView of(ArchiveSummary summary) {
        return new ArchiveSummaryView(
                summary.output().toString(),
                summary.entryCount(),
                summary.totalUncompressed(),
                summary.dataBlockLength(),
                summary.archiveSize(),
                summary.compression().label(),
                summary.encrypted(),
                summary.searchTokenCount(),
                summary.tokensRemaining());
    }
}
