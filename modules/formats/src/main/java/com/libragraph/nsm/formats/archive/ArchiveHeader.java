package com.libragraph.nsm.formats.archive;

import com.libragraph.nsm.types.CompressionType;
import com.libragraph.nsm.types.EncryptionType;
import com.libragraph.nsm.util.ContentHash;

import java.util.Objects;

/**
 * Fixed 64-byte archive header.
 *
 * @param version         format version (1 = index without search section, 2 = current)
 * @param compression     algorithm every frame was compressed with
 * @param encryption      frame encryption, {@link EncryptionType#NONE} when plain
 * @param createdAtMillis creation time, epoch milliseconds
 * @param indexOffset     absolute file offset of the index block
 * @param indexLength     stored length of the index block
 * @param dataChecksum    BLAKE3-256 of the whole data block
 */
public record ArchiveHeader(
        int version,
        CompressionType compression,
        EncryptionType encryption,
        long createdAtMillis,
        long indexOffset,
        long indexLength,
        ContentHash dataChecksum
) {
    public static final int MAGIC = 0x4E534D01;
    public static final int SIZE = 64;
    public static final int VERSION_1 = 1;
    public static final int CURRENT_VERSION = 2;

    public ArchiveHeader {
        Objects.requireNonNull(compression, "compression");
        Objects.requireNonNull(encryption, "encryption");
        Objects.requireNonNull(dataChecksum, "dataChecksum");
    }

    public long dataBlockLength() {
        return indexOffset - SIZE;
    }

    public boolean encrypted() {
        return encryption != EncryptionType.NONE;
    }

    public boolean supportsSearchSection() {
        return version >= CURRENT_VERSION;
    }
}
