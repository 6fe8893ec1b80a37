package com.libragraph.nsm.core.archive;

import com.libragraph.nsm.core.search.TokenCollector;
import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.formats.archive.ArchiveHeader;
import com.libragraph.nsm.formats.archive.ArchiveIndex;
import com.libragraph.nsm.formats.archive.HeaderCodec;
import com.libragraph.nsm.formats.archive.IndexCodec;
import com.libragraph.nsm.formats.archive.IndexEntry;
import com.libragraph.nsm.formats.archive.SearchIndex;
import com.libragraph.nsm.formats.compress.CompressionEngine;
import com.libragraph.nsm.formats.crypto.FrameCipher;
import com.libragraph.nsm.types.EncryptionType;
import com.libragraph.nsm.util.ContentHash;
import com.libragraph.nsm.util.io.HashingInputStream;
import com.libragraph.nsm.util.io.HashingOutputStream;
import org.apache.commons.io.input.TeeInputStream;
import org.apache.commons.io.output.CloseShieldOutputStream;
import org.jboss.logging.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one archive: placeholder header, one frame per input, index, then
 * the real header. Everything goes to {@code <output>.partial}, which is
 * forced to disk and renamed over the output only once complete.
 */
final class ArchiveWriter {

    private static final Logger log = Logger.getLogger(ArchiveWriter.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final CompressionEngine compression;
    private final CreateOptions options;

    ArchiveWriter(CompressionEngine compression, CreateOptions options) {
        this.compression = compression;
        this.options = options;
    }

    record Written(ArchiveHeader header, ArchiveIndex index, long archiveSize) {
    }

    Written write(Path output, List<InputPlanner.PlannedInput> inputs) {
        Path target = output.toAbsolutePath().normalize();
        Path partial = target.resolveSibling(target.getFileName() + ".partial");
        try {
            Files.createDirectories(target.getParent());
            Written written = writePartial(partial, inputs);
            moveIntoPlace(partial, target);
            return written;
        } catch (IOException e) {
            deletePartial(partial);
            throw new ArchiveException(ArchiveError.ARCHIVE_WRITE_FAILURE,
                    "Failed to write archive " + target + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deletePartial(partial);
            throw e;
        }
    }

    private Written writePartial(Path partial, List<InputPlanner.PlannedInput> inputs) throws IOException {
        FrameCipher cipher = options.cipher();
        try (FileChannel channel = FileChannel.open(partial, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            // Placeholder header, rewritten once offsets and checksum are known
            channel.write(ByteBuffer.allocate(ArchiveHeader.SIZE), 0);
            channel.position(ArchiveHeader.SIZE);

            OutputStream file = new BufferedOutputStream(
                    CloseShieldOutputStream.wrap(Channels.newOutputStream(channel)), BUFFER_SIZE);
            HashingOutputStream data = new HashingOutputStream(file);
            List<IndexEntry> entries = new ArrayList<>(inputs.size());
            SearchIndex.Builder search = options.buildSearchIndex() ? SearchIndex.builder() : null;

            for (InputPlanner.PlannedInput input : inputs) {
                entries.add(writeFrame(data, input, entries.size(), search, cipher));
            }
            ContentHash dataChecksum = data.hash();
            long dataLength = data.count();

            ArchiveIndex index = new ArchiveIndex(entries, search == null ? null : search.build());
            byte[] indexBytes = IndexCodec.encode(index, ArchiveHeader.CURRENT_VERSION);
            if (cipher != null) {
                indexBytes = cipher.seal(indexBytes, FrameCipher.INDEX_AAD);
            }
            file.write(indexBytes);
            file.flush();

            ArchiveHeader header = new ArchiveHeader(ArchiveHeader.CURRENT_VERSION, options.compression(),
                    cipher == null ? EncryptionType.NONE : EncryptionType.AES_256_GCM,
                    System.currentTimeMillis(), ArchiveHeader.SIZE + dataLength, indexBytes.length, dataChecksum);
            ByteBuffer headerBytes = ByteBuffer.wrap(HeaderCodec.encode(header));
            while (headerBytes.hasRemaining()) {
                channel.write(headerBytes, headerBytes.position());
            }
            channel.force(true);
            return new Written(header, index, channel.size());
        }
    }

    private IndexEntry writeFrame(HashingOutputStream data, InputPlanner.PlannedInput input, int ordinal,
                                  SearchIndex.Builder search, FrameCipher cipher) throws IOException {
        long frameOffset = data.count();
        long modified = Files.getLastModifiedTime(input.source()).toMillis();
        int mode = FileModes.read(input.source());
        TokenCollector tokens = search == null ? null : new TokenCollector();

        HashingInputStream content;
        try (InputStream in = Files.newInputStream(input.source())) {
            content = new HashingInputStream(in);
            InputStream source = tokens == null ? content : new TeeInputStream(content, tokens);
            try (OutputStream sink = cipher == null
                    ? CloseShieldOutputStream.wrap(data)
                    : cipher.encrypt(data, input.archivePath())) {
                compression.compress(sink, source, options.compression());
            }
        } catch (ArchiveException e) {
            throw e.withContext(input.archivePath());
        }

        if (tokens != null) {
            search.add(ordinal, tokens.counts());
            if (!tokens.isComplete()) {
                search.markUnindexed(ordinal);
            }
        }
        long compressedSize = data.count() - frameOffset;
        log.debugf("Frame %s: %d -> %d bytes", input.archivePath(), content.count(), compressedSize);
        return new IndexEntry(input.archivePath(), content.count(), compressedSize, frameOffset,
                modified, mode, content.hash());
    }

    private static void moveIntoPlace(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warnf("Atomic move not supported for %s, replacing non-atomically", target);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warnf(e, "Failed to delete partial archive %s", partial);
        }
    }
}
