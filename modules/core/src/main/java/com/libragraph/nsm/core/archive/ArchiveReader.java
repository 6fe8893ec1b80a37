package com.libragraph.nsm.core.archive;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.formats.archive.ArchiveHeader;
import com.libragraph.nsm.formats.archive.ArchiveIndex;
import com.libragraph.nsm.formats.archive.HeaderCodec;
import com.libragraph.nsm.formats.archive.IndexCodec;
import com.libragraph.nsm.formats.archive.IndexEntry;
import com.libragraph.nsm.formats.compress.CompressionEngine;
import com.libragraph.nsm.formats.crypto.FrameCipher;
import com.libragraph.nsm.util.ContentHash;
import com.libragraph.nsm.util.io.ChannelRangeInputStream;
import com.libragraph.nsm.util.io.HashingInputStream;
import com.libragraph.nsm.util.io.HashingOutputStream;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.output.CloseShieldOutputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Open, validated archive. Construction reads and checks the header, the
 * layout and the index; frames are decoded on demand with positional reads.
 */
final class ArchiveReader implements AutoCloseable {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path archive;
    private final FileChannel channel;
    private final CompressionEngine compression;
    private final FrameCipher cipher;
    private final ArchiveHeader header;
    private final ArchiveIndex index;
    private final long size;

    private ArchiveReader(Path archive, FileChannel channel, CompressionEngine compression, FrameCipher cipher)
            throws IOException {
        this.archive = archive;
        this.channel = channel;
        this.compression = compression;
        this.size = channel.size();
        this.header = HeaderCodec.read(channel);
        HeaderCodec.validateLayout(header, size);
        if (header.encrypted() && cipher == null) {
            throw new ArchiveException(ArchiveError.ENCRYPTION_KEY_REQUIRED,
                    "Archive " + archive + " is encrypted; an encryption key is required");
        }
        this.cipher = header.encrypted() ? cipher : null;
        this.index = readIndex();
    }

    static ArchiveReader open(Path archive, CompressionEngine compression, FrameCipher cipher) {
        FileChannel channel;
        try {
            channel = FileChannel.open(archive, StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE, "Archive not found: " + archive, e);
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE,
                    "Failed to open archive " + archive + ": " + e.getMessage(), e);
        }
        try {
            return new ArchiveReader(archive, channel, compression, cipher);
        } catch (IOException e) {
            closeOnFailure(channel, e);
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE,
                    "Failed to read archive " + archive + ": " + e.getMessage(), e);
        } catch (ArchiveException e) {
            closeOnFailure(channel, e);
            throw e.withContext(archive.toString());
        }
    }

    private ArchiveIndex readIndex() throws IOException {
        if (header.indexLength() > Integer.MAX_VALUE - 8) {
            throw new ArchiveException(ArchiveError.INVALID_FORMAT, "Index too large: " + header.indexLength());
        }
        byte[] bytes;
        try (InputStream in = new ChannelRangeInputStream(channel, header.indexOffset(), header.indexLength())) {
            bytes = in.readAllBytes();
        }
        if (cipher != null) {
            bytes = cipher.open(bytes, FrameCipher.INDEX_AAD);
        }
        return IndexCodec.decode(bytes, header.version(), header.dataBlockLength());
    }

    ArchiveHeader header() {
        return header;
    }

    ArchiveIndex index() {
        return index;
    }

    long size() {
        return size;
    }

    /**
     * Hashes the whole data block and compares it with the header.
     */
    void verifyDataChecksum() {
        try (HashingInputStream in = new HashingInputStream(new BufferedInputStream(
                new ChannelRangeInputStream(channel, ArchiveHeader.SIZE, header.dataBlockLength()), BUFFER_SIZE))) {
            IOUtils.consume(in);
            ContentHash actual = in.hash();
            if (!actual.equals(header.dataChecksum())) {
                throw new ArchiveException(ArchiveError.CHECKSUM_MISMATCH,
                        "Data block checksum mismatch in " + archive + ": expected "
                                + header.dataChecksum() + ", got " + actual);
            }
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE,
                    "Failed to read data block of " + archive + ": " + e.getMessage(), e);
        }
    }

    /**
     * Decodes one entry onto {@code out} and checks its size and content
     * checksum. {@code out} is not closed.
     *
     * @return uncompressed bytes written
     */
    long decode(IndexEntry entry, OutputStream out) {
        HashingOutputStream hashed = new HashingOutputStream(CloseShieldOutputStream.wrap(out));
        long written;
        try (InputStream raw = new BufferedInputStream(new ChannelRangeInputStream(channel,
                ArchiveHeader.SIZE + entry.frameOffset(), entry.compressedSize()), BUFFER_SIZE);
             InputStream frame = cipher == null ? raw : cipher.decrypt(raw, entry.path())) {
            written = compression.decompress(hashed, frame, header.compression());
            // Drains any authentication tag the decoder did not need
            IOUtils.consume(frame);
            hashed.flush();
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE,
                    "Failed to read entry " + entry.path() + " of " + archive + ": " + e.getMessage(), e);
        } catch (ArchiveException e) {
            throw e.withContext(entry.path());
        }
        if (written != entry.uncompressedSize() || !hashed.hash().equals(entry.checksum())) {
            throw new ArchiveException(ArchiveError.CHECKSUM_MISMATCH,
                    "Content checksum mismatch for entry " + entry.path() + " of " + archive);
        }
        return written;
    }

    private static void closeOnFailure(FileChannel channel, Exception failure) {
        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public void close() {
        try {
            channel.close();
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE, "Failed to close " + archive, e);
        }
    }
}
