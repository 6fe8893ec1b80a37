package com.libragraph.nsm.util.io;

import com.libragraph.nsm.util.ContentHash;
import org.apache.commons.codec.digest.Blake3;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Pass-through output stream that feeds every byte written into an
 * incremental BLAKE3 hasher and counts them.
 *
 * {@link #hash()} finalizes the digest; writes after that are rejected.
 */
public class HashingOutputStream extends FilterOutputStream {

    private final Blake3 hasher = Blake3.initHash();
    private long count;
    private ContentHash finalHash;

    public HashingOutputStream(OutputStream out) {
        super(out);
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpenForHashing();
        out.write(b);
        hasher.update(new byte[]{(byte) b});
        count++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureOpenForHashing();
        out.write(b, off, len);
        hasher.update(b, off, len);
        count += len;
    }

    /** Bytes written so far. */
    public long count() {
        return count;
    }

    /**
     * Finalizes and returns the hash of everything written.
     * Idempotent.
     */
    public ContentHash hash() {
        if (finalHash == null) {
            finalHash = new ContentHash(hasher.doFinalize(ContentHash.HASH_LENGTH));
        }
        return finalHash;
    }

    private void ensureOpenForHashing() {
        if (finalHash != null) {
            throw new IllegalStateException("Hash already finalized");
        }
    }
}
