package com.libragraph.nsm.api.model;

import com.libragraph.nsm.core.archive.ArchiveInfo;
import com.libragraph.nsm.formats.archive.IndexEntry;

import java.time.Instant;
import java.util.List;

public record ArchiveInfoView(
        String archive,
        int version,
        String compression,
        String encryption,
        Instant createdAt,
        long dataBlockLength,
        long indexLength,
        long archiveSize,
        String dataChecksum,
        boolean hasSearchIndex,
        int searchTokenCount,
        List<Entry> entries
) {
    /**
     * @param mode POSIX permission bits in octal notation, e.g. "644"
     */
    public record Entry(
            String path,
            long size,
            long compressedSize,
            long frameOffset,
            Instant modified,
            String mode,
            String checksum
    ) {
        static Entry of(IndexEntry e) {
            return new Entry(
                    e.path(),
                    e.uncompressedSize(),
                    e.compressedSize(),
                    e.frameOffset(),
                    Instant.ofEpochMilli(e.modifiedMillis()),
                    Integer.toOctalString(e.mode()),
                    e.checksum().toHex());
        }
    }

    public static ArchiveInfoView of(ArchiveInfo info) {
        return new ArchiveInfoView(
                info.archive().toString(),
                info.version(),
                info.compression().label(),
                info.encryption().name(),
                info.createdAt(),
                info.dataBlockLength(),
                info.indexLength(),
                info.archiveSize(),
                info.dataChecksum(),
                info.hasSearchIndex(),
                info.searchTokenCount(),
                info.entries().stream().map(Entry::of).toList());
    }
}
