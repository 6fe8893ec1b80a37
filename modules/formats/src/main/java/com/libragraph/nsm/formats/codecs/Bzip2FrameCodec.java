package com.libragraph.nsm.formats.codecs;

import com.libragraph.nsm.formats.api.FrameCodec;
import com.libragraph.nsm.formats.api.FrameDecoder;
import com.libragraph.nsm.formats.api.FrameEncoder;
import com.libragraph.nsm.types.CompressionType;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.io.input.CloseShieldInputStream;
import org.apache.commons.io.output.CloseShieldOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Codec for BZIP2 frames.
 * Uses Apache Commons Compress for BZIP2 support.
 *
 * The Commons Compress streams keep no reusable state between frames, so
 * reset is a no-op; the pool still bounds how many are alive.
 */
public class Bzip2FrameCodec implements FrameCodec {

    private final int blockSize;

    public Bzip2FrameCodec() {
        this(BZip2CompressorOutputStream.MAX_BLOCKSIZE);
    }

    public Bzip2FrameCodec(int blockSize) {
        if (blockSize < BZip2CompressorOutputStream.MIN_BLOCKSIZE
                || blockSize > BZip2CompressorOutputStream.MAX_BLOCKSIZE) {
            throw new IllegalArgumentException("BZIP2 block size must be 1-9, got: " + blockSize);
        }
        this.blockSize = blockSize;
    }

    @Override
    public CompressionType type() {
        return CompressionType.BZIP2;
    }

    @Override
    public FrameEncoder newEncoder() {
        return new FrameEncoder() {
            @Override
            public OutputStream open(OutputStream sink) throws IOException {
                return new BZip2CompressorOutputStream(CloseShieldOutputStream.wrap(sink), blockSize);
            }

            @Override
            public void reset() {
            }
        };
    }

    @Override
    public FrameDecoder newDecoder() {
        return new FrameDecoder() {
            @Override
            public InputStream open(InputStream source) throws IOException {
                return new BZip2CompressorInputStream(CloseShieldInputStream.wrap(source), false);
            }

            @Override
            public void reset() {
            }
        };
    }
}
