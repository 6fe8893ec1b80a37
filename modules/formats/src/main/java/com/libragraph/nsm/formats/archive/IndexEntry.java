package com.libragraph.nsm.formats.archive;

import com.libragraph.nsm.util.ContentHash;

import java.util.Objects;

/**
 * One archived file: where its frame lives in the data block and what the
 * original content looked like.
 *
 * @param frameOffset offset of the frame relative to the start of the data block
 * @param mode        POSIX permission bits (e.g. 0644)
 * @param checksum    BLAKE3-256 of the uncompressed content
 */
public record IndexEntry(
        String path,
        long uncompressedSize,
        long compressedSize,
        long frameOffset,
        long modifiedMillis,
        int mode,
        ContentHash checksum
) {
    public IndexEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(checksum, "checksum");
        if (uncompressedSize < 0 || compressedSize < 0 || frameOffset < 0) {
            throw new IllegalArgumentException("Negative size or offset for entry " + path);
        }
    }

    public long frameEnd() {
        return frameOffset + compressedSize;
    }
}
