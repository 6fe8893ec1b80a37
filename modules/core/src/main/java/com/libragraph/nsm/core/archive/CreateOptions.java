package com.libragraph.nsm.core.archive;

import com.libragraph.nsm.formats.crypto.FrameCipher;
import com.libragraph.nsm.types.CompressionType;

import java.util.Objects;

/**
 * Options for {@link ArchiveEngine#create}.
 *
 * @param cipher            frame encryption, null for a plain archive
 * @param buildSearchIndex  whether to tokenize content into a search index
 */
public record CreateOptions(CompressionType compression, FrameCipher cipher, boolean buildSearchIndex) {

    public CreateOptions {
        Objects.requireNonNull(compression, "compression");
    }

    public static CreateOptions defaults() {
        return new CreateOptions(CompressionType.ZSTD, null, true);
    }

    public CreateOptions withCompression(CompressionType type) {
        return new CreateOptions(type, cipher, buildSearchIndex);
    }

    public CreateOptions withCipher(FrameCipher frameCipher) {
        return new CreateOptions(compression, frameCipher, buildSearchIndex);
    }

    public CreateOptions withSearchIndex(boolean build) {
        return new CreateOptions(compression, cipher, build);
    }
}
