package com.libragraph.nsm.formats.archive;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.util.ContentHash;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.CRC32C;

/**
 * Self-delimiting binary encoding of the archive index. Big-endian.
 *
 * <pre>
 * u32 entryCount
 * entryCount x { u16 pathLen, path (UTF-8), i64 uncompressed, i64 compressed,
 *                i64 frameOffset, i64 modifiedMillis, i32 mode, 32B checksum }
 * u8  hasSearchIndex                                  (version 2 only)
 * if 1: u32 unindexedCount, unindexedCount x u32 ordinal (ascending)
 *       u32 tokenCount, tokenCount x { u16 len, token, u32 postingCount,
 *                                      postingCount x { u32 ordinal, u32 occurrences } }
 * u32 CRC32C of everything above
 * </pre>
 */
public final class IndexCodec {

    /** Smallest valid plain encoding: empty entry list plus trailer. */
    public static final int MIN_LENGTH = 8;

    private static final int MAX_U16 = 0xFFFF;

    private IndexCodec() {
    }

    public static byte[] encode(ArchiveIndex index, int version) {
        if (version == ArchiveHeader.VERSION_1 && index.searchIndex().isPresent()) {
            throw new IllegalArgumentException("Version 1 index cannot carry a search index");
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(index.size());
            for (IndexEntry e : index.entries()) {
                writeShortString(out, e.path().getBytes(StandardCharsets.UTF_8), "path");
                out.writeLong(e.uncompressedSize());
                out.writeLong(e.compressedSize());
                out.writeLong(e.frameOffset());
                out.writeLong(e.modifiedMillis());
                out.writeInt(e.mode());
                out.write(e.checksum().bytes());
            }
            if (version >= ArchiveHeader.CURRENT_VERSION) {
                SearchIndex search = index.searchIndex().orElse(null);
                out.writeByte(search == null ? 0 : 1);
                if (search != null) {
                    out.writeInt(search.unindexedEntries().size());
                    for (int ordinal : search.unindexedEntries()) {
                        out.writeInt(ordinal);
                    }
                    out.writeInt(search.tokenCount());
                    for (String token : search.tokens()) {
                        writeShortString(out, token.getBytes(StandardCharsets.ISO_8859_1), "token");
                        List<SearchIndex.Posting> postings = search.postings(token);
                        out.writeInt(postings.size());
                        for (SearchIndex.Posting p : postings) {
                            out.writeInt(p.entryOrdinal());
                            out.writeInt(p.occurrences());
                        }
                    }
                }
            }
            out.flush();
            CRC32C crc = new CRC32C();
            crc.update(bytes.toByteArray());
            out.writeInt((int) crc.getValue());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * Decodes an index block, consuming exactly {@code bytes.length} bytes.
     *
     * @param dataBlockLength length of the data block the frames must tile exactly
     */
    public static ArchiveIndex decode(byte[] bytes, int version, long dataBlockLength) {
        if (bytes.length < MIN_LENGTH) {
            throw invalid("Index block too short: " + bytes.length + " bytes");
        }
        int bodyLength = bytes.length - 4;
        CRC32C crc = new CRC32C();
        crc.update(bytes, 0, bodyLength);
        int expected = ByteBuffer.wrap(bytes, bodyLength, 4).getInt();
        if ((int) crc.getValue() != expected) {
            throw invalid("Index CRC32C mismatch");
        }

        ByteBuffer buf = ByteBuffer.wrap(bytes, 0, bodyLength);
        try {
            List<IndexEntry> entries = readEntries(buf, dataBlockLength);
            SearchIndex search = null;
            if (version >= ArchiveHeader.CURRENT_VERSION) {
                int flag = Byte.toUnsignedInt(buf.get());
                if (flag == 1) {
                    search = readSearchIndex(buf, entries.size());
                } else if (flag != 0) {
                    throw invalid("Bad search index flag: " + flag);
                }
            }
            if (buf.hasRemaining()) {
                throw invalid(buf.remaining() + " trailing bytes after index");
            }
            return new ArchiveIndex(entries, search);
        } catch (BufferUnderflowException e) {
            throw new ArchiveException(ArchiveError.INVALID_FORMAT, "Index block truncated", e);
        }
    }

    private static List<IndexEntry> readEntries(ByteBuffer buf, long dataBlockLength) {
        long count = Integer.toUnsignedLong(buf.getInt());
        // Each entry needs at least 2 + 36 + 32 bytes; bounds the allocation below
        if (count > buf.remaining() / 70) {
            throw invalid("Entry count " + count + " exceeds index size");
        }
        List<IndexEntry> entries = new ArrayList<>((int) count);
        Set<String> seen = new HashSet<>();
        long cursor = 0;
        for (int i = 0; i < count; i++) {
            String path = new String(readShortString(buf), StandardCharsets.UTF_8);
            long uncompressed = buf.getLong();
            long compressed = buf.getLong();
            long offset = buf.getLong();
            long modified = buf.getLong();
            int mode = buf.getInt();
            byte[] checksum = new byte[ContentHash.HASH_LENGTH];
            buf.get(checksum);

            if (path.isEmpty() || !seen.add(path)) {
                throw invalid("Empty or duplicate entry path: '" + path + "'");
            }
            if (uncompressed < 0 || compressed < 0) {
                throw invalid("Negative size for entry " + path);
            }
            if (offset != cursor) {
                throw invalid("Entry " + path + " frame at " + offset + ", expected " + cursor);
            }
            cursor = offset + compressed;
            if (cursor > dataBlockLength) {
                throw invalid("Entry " + path + " frame runs past the data block");
            }
            entries.add(new IndexEntry(path, uncompressed, compressed, offset, modified, mode,
                    new ContentHash(checksum)));
        }
        if (cursor != dataBlockLength) {
            throw invalid("Frames cover " + cursor + " of " + dataBlockLength + " data block bytes");
        }
        return entries;
    }

    private static SearchIndex readSearchIndex(ByteBuffer buf, int entryCount) {
        SearchIndex.Builder builder = SearchIndex.builder();
        long unindexedCount = Integer.toUnsignedLong(buf.getInt());
        if (unindexedCount > entryCount) {
            throw invalid("Unindexed entry count " + unindexedCount + " exceeds entry count " + entryCount);
        }
        long previous = -1;
        for (long i = 0; i < unindexedCount; i++) {
            long ordinal = Integer.toUnsignedLong(buf.getInt());
            if (ordinal <= previous || ordinal >= entryCount) {
                throw invalid("Bad unindexed entry ordinal " + ordinal);
            }
            builder.markUnindexed((int) ordinal);
            previous = ordinal;
        }

        long tokenCount = Integer.toUnsignedLong(buf.getInt());
        Map<Integer, Map<String, Integer>> byEntry = new LinkedHashMap<>();
        for (long t = 0; t < tokenCount; t++) {
            String token = new String(readShortString(buf), StandardCharsets.ISO_8859_1);
            long postingCount = Integer.toUnsignedLong(buf.getInt());
            if (postingCount > buf.remaining() / 8) {
                throw invalid("Posting count " + postingCount + " exceeds index size");
            }
            for (long p = 0; p < postingCount; p++) {
                long ordinal = Integer.toUnsignedLong(buf.getInt());
                long occurrences = Integer.toUnsignedLong(buf.getInt());
                if (ordinal >= entryCount) {
                    throw invalid("Posting for token '" + token + "' references entry " + ordinal
                            + " of " + entryCount);
                }
                if (occurrences == 0 || occurrences > Integer.MAX_VALUE) {
                    throw invalid("Bad occurrence count " + occurrences + " for token '" + token + "'");
                }
                byEntry.computeIfAbsent((int) ordinal, o -> new LinkedHashMap<>())
                        .merge(token, (int) occurrences, Integer::sum);
            }
        }
        byEntry.keySet().stream().sorted().forEach(ordinal -> builder.add(ordinal, byEntry.get(ordinal)));
        return builder.build();
    }

    private static void writeShortString(DataOutputStream out, byte[] value, String what) throws IOException {
        if (value.length > MAX_U16) {
            throw new IllegalArgumentException(what + " longer than " + MAX_U16 + " bytes");
        }
        out.writeShort(value.length);
        out.write(value);
    }

    private static byte[] readShortString(ByteBuffer buf) {
        int len = Short.toUnsignedInt(buf.getShort());
        byte[] value = new byte[len];
        buf.get(value);
        return value;
    }

    private static ArchiveException invalid(String message) {
        return new ArchiveException(ArchiveError.INVALID_FORMAT, message);
    }
}
