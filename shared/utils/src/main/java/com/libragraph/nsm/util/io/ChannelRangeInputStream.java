package com.libragraph.nsm.util.io;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Objects;

/**
 * Reads exactly {@code length} bytes of a {@link FileChannel} starting at
 * {@code start}, using positional reads so the channel's own position is
 * never touched. Several streams may read the same channel concurrently.
 *
 * Closing the stream does not close the channel.
 */
public class ChannelRangeInputStream extends InputStream {

    private final FileChannel channel;
    private final long end;
    private long position;

    public ChannelRangeInputStream(FileChannel channel, long start, long length) {
        this.channel = Objects.requireNonNull(channel, "channel");
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("Negative range: start=" + start + " length=" + length);
        }
        this.position = start;
        this.end = start + length;
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
        long remaining = end - position;
        if (remaining <= 0) return -1;

        int toRead = (int) Math.min(len, remaining);
        int n = channel.read(ByteBuffer.wrap(b, off, toRead), position);
        if (n == -1) {
            throw new EOFException("Channel ended " + remaining + " bytes before end of range");
        }
        position += n;
        return n;
    }

    @Override
    public long skip(long n) {
        long skipped = Math.max(0, Math.min(n, end - position));
        position += skipped;
        return skipped;
    }

    @Override
    public int available() {
        return (int) Math.min(Integer.MAX_VALUE, end - position);
    }
}
