package com.libragraph.nsm.formats.codecs;

import com.libragraph.nsm.formats.api.FrameCodec;
import com.libragraph.nsm.formats.api.FrameDecoder;
import com.libragraph.nsm.formats.api.FrameEncoder;
import com.libragraph.nsm.types.CompressionType;
import org.apache.commons.io.input.CloseShieldInputStream;
import org.apache.commons.io.output.CloseShieldOutputStream;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Codec for DEFLATE frames in the zlib container (RFC 1950).
 * Widely compatible fallback; readable by any zlib implementation.
 *
 * {@link Deflater} and {@link Inflater} allocate native zlib state, so they
 * are kept in the encoder/decoder and reset between frames.
 */
public class DeflateFrameCodec implements FrameCodec {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final int level;

    public DeflateFrameCodec() {
        this(Deflater.DEFAULT_COMPRESSION);
    }

    public DeflateFrameCodec(int level) {
        if (level != Deflater.DEFAULT_COMPRESSION && (level < 0 || level > 9)) {
            throw new IllegalArgumentException("DEFLATE level must be 0-9, got: " + level);
        }
        this.level = level;
    }

    @Override
    public CompressionType type() {
        return CompressionType.DEFLATE;
    }

    @Override
    public FrameEncoder newEncoder() {
        return new Encoder(new Deflater(level));
    }

    @Override
    public FrameDecoder newDecoder() {
        return new Decoder(new Inflater());
    }

    private static final class Encoder implements FrameEncoder {
        private final Deflater deflater;

        Encoder(Deflater deflater) {
            this.deflater = deflater;
        }

        @Override
        public OutputStream open(OutputStream sink) {
            // A caller-supplied Deflater is not ended when the stream closes
            return new DeflaterOutputStream(CloseShieldOutputStream.wrap(sink), deflater, BUFFER_SIZE);
        }

        @Override
        public void reset() {
            deflater.reset();
        }

        @Override
        public void destroy() {
            deflater.end();
        }
    }

    private static final class Decoder implements FrameDecoder {
        private final Inflater inflater;

        Decoder(Inflater inflater) {
            this.inflater = inflater;
        }

        @Override
        public InputStream open(InputStream source) {
            return new InflaterInputStream(CloseShieldInputStream.wrap(source), inflater, BUFFER_SIZE);
        }

        @Override
        public void reset() {
            inflater.reset();
        }

        @Override
        public void destroy() {
            inflater.end();
        }
    }
}
