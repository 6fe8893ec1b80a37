package com.libragraph.nsm.util.io;

import com.libragraph.nsm.util.ContentHash;
import org.apache.commons.codec.digest.Blake3;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Pass-through input stream that hashes (BLAKE3) and counts every byte read.
 * Mark/reset is not supported since it would hash bytes twice.
 */
public class HashingInputStream extends FilterInputStream {

    private final Blake3 hasher = Blake3.initHash();
    private long count;
    private ContentHash finalHash;

    public HashingInputStream(InputStream in) {
        super(in);
    }

    @Override
    public int read() throws IOException {
        int b = in.read();
        if (b != -1) {
            hasher.update(new byte[]{(byte) b});
            count++;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = in.read(b, off, len);
        if (n > 0) {
            hasher.update(b, off, n);
            count += n;
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        // Skipped bytes must still be hashed
        byte[] scratch = new byte[8192];
        long remaining = n;
        while (remaining > 0) {
            int r = read(scratch, 0, (int) Math.min(scratch.length, remaining));
            if (r == -1) break;
            remaining -= r;
        }
        return n - remaining;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    @Override
    public synchronized void mark(int readlimit) {
    }

    @Override
    public synchronized void reset() throws IOException {
        throw new IOException("mark/reset not supported");
    }

    /** Bytes read so far. */
    public long count() {
        return count;
    }

    /**
     * Finalizes and returns the hash of everything read. Idempotent.
     */
    public ContentHash hash() {
        if (finalHash == null) {
            finalHash = new ContentHash(hasher.doFinalize(ContentHash.HASH_LENGTH));
        }
        return finalHash;
    }
}
