package com.libragraph.nsm.formats.registry;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.formats.api.FrameCodec;
import com.libragraph.nsm.formats.codecs.Bzip2FrameCodec;
import com.libragraph.nsm.formats.codecs.DeflateFrameCodec;
import com.libragraph.nsm.formats.codecs.ZstdFrameCodec;
import com.libragraph.nsm.types.CompressionType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Central registry that maps compression algorithms to frame codecs.
 * The algorithm always comes from the archive header; nothing is sniffed.
 */
public class CodecRegistry {

    private final Map<CompressionType, FrameCodec> codecs = new EnumMap<>(CompressionType.class);

    public CodecRegistry(Collection<? extends FrameCodec> codecs) {
        for (FrameCodec codec : codecs) {
            register(codec);
        }
    }

    /**
     * Registry with every built-in codec.
     */
    public static CodecRegistry defaults(int zstdLevel) {
        return new CodecRegistry(List.of(
                new ZstdFrameCodec(zstdLevel),
                new DeflateFrameCodec(),
                new Bzip2FrameCodec()));
    }

    /**
     * Registers a codec, replacing any codec for the same algorithm.
     */
    public final void register(FrameCodec codec) {
        codecs.put(codec.type(), codec);
    }

    public Optional<FrameCodec> find(CompressionType type) {
        return Optional.ofNullable(codecs.get(type));
    }

    public FrameCodec require(CompressionType type) {
        FrameCodec codec = codecs.get(type);
        if (codec == null) {
            throw new ArchiveException(ArchiveError.UNSUPPORTED_ALGORITHM,
                    "No codec registered for " + type.label());
        }
        return codec;
    }

    public Collection<CompressionType> supported() {
        return Collections.unmodifiableSet(codecs.keySet());
    }
}
