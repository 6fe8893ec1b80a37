package com.libragraph.nsm.formats.codecs;

import com.github.luben.zstd.EndDirective;
import com.github.luben.zstd.ZstdCompressCtx;
import com.github.luben.zstd.ZstdDecompressCtx;
import com.github.luben.zstd.ZstdException;
import com.libragraph.nsm.formats.api.FrameCodec;
import com.libragraph.nsm.formats.api.FrameDecoder;
import com.libragraph.nsm.formats.api.FrameEncoder;
import com.libragraph.nsm.types.CompressionType;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Codec for Zstandard frames (default, high ratio) using zstd-jni.
 *
 * Each encoder/decoder owns a native zstd context plus a pair of direct
 * buffers, reused across frames. One zstd frame is produced per archive
 * entry, with the zstd content checksum enabled.
 */
public class ZstdFrameCodec implements FrameCodec {

    /** The default compression level for Zstandard compression. */
    public static final int DEFAULT_LEVEL = 3;

    private static final int BUFFER_SIZE = 128 * 1024;

    private final int level;

    public ZstdFrameCodec() {
        this(DEFAULT_LEVEL);
    }

    public ZstdFrameCodec(int level) {
        if (level < 1 || level > 22) {
            throw new IllegalArgumentException("ZSTD level must be 1-22, got: " + level);
        }
        this.level = level;
    }

    public int level() {
        return level;
    }

    @Override
    public CompressionType type() {
        return CompressionType.ZSTD;
    }

    @Override
    public FrameEncoder newEncoder() {
        return new Encoder(level);
    }

    @Override
    public FrameDecoder newDecoder() {
        return new Decoder();
    }

    private static final class Encoder implements FrameEncoder {
        private final int level;
        private final ZstdCompressCtx ctx = new ZstdCompressCtx();
        private final ByteBuffer in = ByteBuffer.allocateDirect(BUFFER_SIZE);
        private final ByteBuffer out = ByteBuffer.allocateDirect(BUFFER_SIZE + BUFFER_SIZE / 2);
        private final byte[] scratch = new byte[out.capacity()];

        Encoder(int level) {
            this.level = level;
            configure();
        }

        private void configure() {
            ctx.setLevel(level);
            ctx.setChecksum(true);
        }

        @Override
        public OutputStream open(OutputStream sink) {
            in.clear();
            return new FrameOutputStream(Objects.requireNonNull(sink, "sink"));
        }

        @Override
        public void reset() {
            ctx.reset();
            configure();
            in.clear();
            out.clear();
        }

        @Override
        public void destroy() {
            ctx.close();
        }

        private final class FrameOutputStream extends OutputStream {
            private final OutputStream sink;
            private boolean closed;

            FrameOutputStream(OutputStream sink) {
                this.sink = sink;
            }

            @Override
            public void write(int b) throws IOException {
                write(new byte[]{(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                Objects.checkFromIndexSize(off, len, b.length);
                if (closed) throw new IOException("Frame already closed");
                while (len > 0) {
                    int n = Math.min(len, in.remaining());
                    in.put(b, off, n);
                    off += n;
                    len -= n;
                    if (!in.hasRemaining()) {
                        drain(EndDirective.CONTINUE);
                    }
                }
            }

            @Override
            public void close() throws IOException {
                if (closed) return;
                closed = true;
                drain(EndDirective.END);
                sink.flush();
            }

            private void drain(EndDirective directive) throws IOException {
                in.flip();
                try {
                    while (true) {
                        out.clear();
                        boolean flushed = ctx.compressDirectByteBufferStream(out, in, directive);
                        out.flip();
                        int produced = out.remaining();
                        out.get(scratch, 0, produced);
                        sink.write(scratch, 0, produced);
                        if (in.hasRemaining()) continue;
                        if (directive == EndDirective.CONTINUE || flushed) break;
                    }
                } catch (ZstdException e) {
                    throw new IOException("zstd compression failed: " + e.getMessage(), e);
                }
                in.clear();
            }
        }
    }

    private static final class Decoder implements FrameDecoder {
        private final ZstdDecompressCtx ctx = new ZstdDecompressCtx();
        private final ByteBuffer in = ByteBuffer.allocateDirect(BUFFER_SIZE);
        private final ByteBuffer out = ByteBuffer.allocateDirect(BUFFER_SIZE);
        private final byte[] scratch = new byte[BUFFER_SIZE];

        @Override
        public InputStream open(InputStream source) {
            in.clear().flip();
            out.clear().flip();
            return new FrameInputStream(Objects.requireNonNull(source, "source"));
        }

        @Override
        public void reset() {
            ctx.reset();
            in.clear();
            out.clear();
        }

        @Override
        public void destroy() {
            ctx.close();
        }

        private final class FrameInputStream extends InputStream {
            private final InputStream source;
            private boolean frameDone;
            private boolean outputWasFull;

            FrameInputStream(InputStream source) {
                this.source = source;
            }

            @Override
            public int read() throws IOException {
                byte[] one = new byte[1];
                int n = read(one, 0, 1);
                return n == -1 ? -1 : one[0] & 0xFF;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                Objects.checkFromIndexSize(off, len, b.length);
                if (len == 0) return 0;
                while (!out.hasRemaining()) {
                    if (frameDone) return -1;
                    decodeMore();
                }
                int n = Math.min(len, out.remaining());
                out.get(b, off, n);
                return n;
            }

            private void decodeMore() throws IOException {
                // Pending output inside zstd is drained before more input is fed
                if (!in.hasRemaining() && !outputWasFull) {
                    int r = source.read(scratch, 0, in.capacity());
                    if (r == -1) {
                        throw new EOFException("Truncated zstd frame");
                    }
                    in.clear();
                    in.put(scratch, 0, r);
                    in.flip();
                }
                out.clear();
                try {
                    frameDone = ctx.decompressDirectByteBufferStream(out, in);
                } catch (ZstdException e) {
                    throw new IOException("zstd decompression failed: " + e.getMessage(), e);
                }
                outputWasFull = !out.hasRemaining();
                out.flip();
            }
        }
    }
}
