package com.libragraph.nsm.formats.archive;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.types.CompressionType;
import com.libragraph.nsm.types.EncryptionType;
import com.libragraph.nsm.util.ContentHash;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Encodes and decodes the 64-byte header. Big-endian throughout.
 *
 * <pre>
 *  0  u32  magic 0x4E534D01
 *  4  u16  version
 *  6  u8   compression tag
 *  7  u8   encryption tag
 *  8  i64  created at (epoch millis)
 * 16  i64  index offset
 * 24  i64  index length
 * 32  32B  BLAKE3-256 of the data block
 * </pre>
 */
public final class HeaderCodec {

    private HeaderCodec() {
    }

    public static byte[] encode(ArchiveHeader header) {
        ByteBuffer buf = ByteBuffer.allocate(ArchiveHeader.SIZE);
        buf.putInt(ArchiveHeader.MAGIC);
        buf.putShort((short) header.version());
        buf.put((byte) header.compression().tag());
        buf.put((byte) header.encryption().tag());
        buf.putLong(header.createdAtMillis());
        buf.putLong(header.indexOffset());
        buf.putLong(header.indexLength());
        buf.put(header.dataChecksum().bytes());
        return buf.array();
    }

    public static ArchiveHeader decode(byte[] bytes) {
        if (bytes.length < ArchiveHeader.SIZE) {
            throw new ArchiveException(ArchiveError.INVALID_FORMAT,
                    "Header truncated: " + bytes.length + " of " + ArchiveHeader.SIZE + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes, 0, ArchiveHeader.SIZE);
        int magic = buf.getInt();
        if (magic != ArchiveHeader.MAGIC) {
            throw new ArchiveException(ArchiveError.INVALID_FORMAT,
                    String.format("Bad magic 0x%08X", magic));
        }
        int version = Short.toUnsignedInt(buf.getShort());
        if (version == 0) {
            throw new ArchiveException(ArchiveError.INVALID_FORMAT, "Format version 0 is not valid");
        }
        if (version > ArchiveHeader.CURRENT_VERSION) {
            throw new ArchiveException(ArchiveError.UNSUPPORTED_VERSION,
                    "Format version " + version + " is newer than supported version " + ArchiveHeader.CURRENT_VERSION);
        }
        int compressionTag = Byte.toUnsignedInt(buf.get());
        int encryptionTag = Byte.toUnsignedInt(buf.get());
        CompressionType compression;
        EncryptionType encryption;
        try {
            compression = CompressionType.fromTag(compressionTag);
            encryption = EncryptionType.fromTag(encryptionTag);
        } catch (IllegalArgumentException e) {
            throw new ArchiveException(ArchiveError.UNSUPPORTED_ALGORITHM, e.getMessage(), e);
        }
        long createdAt = buf.getLong();
        long indexOffset = buf.getLong();
        long indexLength = buf.getLong();
        byte[] checksum = new byte[ContentHash.HASH_LENGTH];
        buf.get(checksum);
        return new ArchiveHeader(version, compression, encryption, createdAt,
                indexOffset, indexLength, new ContentHash(checksum));
    }

    /**
     * Reads and decodes the header at position 0 without moving the channel.
     */
    public static ArchiveHeader read(FileChannel channel) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(ArchiveHeader.SIZE);
        long pos = 0;
        while (buf.hasRemaining()) {
            int n = channel.read(buf, pos);
            if (n < 0) break;
            pos += n;
        }
        byte[] bytes = new byte[buf.position()];
        buf.flip();
        buf.get(bytes);
        return decode(bytes);
    }

    /**
     * Checks the layout invariant: index follows the data block directly and
     * ends exactly at the end of the file.
     */
    public static void validateLayout(ArchiveHeader header, long fileSize) {
        long offset = header.indexOffset();
        long length = header.indexLength();
        if (offset < ArchiveHeader.SIZE || length < IndexCodec.MIN_LENGTH) {
            throw new ArchiveException(ArchiveError.INVALID_FORMAT,
                    "Index bounds out of range: offset=" + offset + " length=" + length);
        }
        if (offset > fileSize || length != fileSize - offset) {
            throw new ArchiveException(ArchiveError.INVALID_FORMAT,
                    "Index [" + offset + ", +" + length + ") does not end at file size " + fileSize);
        }
    }
}
