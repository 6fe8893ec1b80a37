package com.libragraph.nsm.core.archive;

import com.libragraph.nsm.types.CompressionType;

import java.nio.file.Path;

/**
 * Outcome of a successful create.
 */
public record ArchiveSummary(
        Path output,
        int entryCount,
        long totalUncompressed,
        long dataBlockLength,
        long archiveSize,
        CompressionType compression,
        boolean encrypted,
        int searchTokenCount,
        int tokensRemaining
) {
}
