package com.libragraph.nsm.core.archive;

import com.libragraph.nsm.formats.archive.IndexEntry;
import com.libragraph.nsm.types.CompressionType;
import com.libragraph.nsm.types.EncryptionType;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Header fields and entry list of an archive, as returned by inspect and verify.
 */
public record ArchiveInfo(
        Path archive,
        int version,
        CompressionType compression,
        EncryptionType encryption,
        Instant createdAt,
        long dataBlockLength,
        long indexLength,
        long archiveSize,
        String dataChecksum,
        boolean hasSearchIndex,
        int searchTokenCount,
        List<IndexEntry> entries
) {
    public ArchiveInfo {
        entries = List.copyOf(entries);
    }
}
