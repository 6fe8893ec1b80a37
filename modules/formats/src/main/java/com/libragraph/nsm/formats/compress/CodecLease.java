package com.libragraph.nsm.formats.compress;

import com.libragraph.nsm.formats.api.CodecState;
import com.libragraph.nsm.types.CompressionType;
import org.apache.commons.pool2.KeyedObjectPool;

/**
 * Scoped checkout of one pooled codec state. Use with try-with-resources:
 * call {@link #markClean()} once the frame stream closed normally, otherwise
 * the state is considered poisoned and is destroyed instead of returned.
 */
public final class CodecLease<S extends CodecState> implements AutoCloseable {

    private final KeyedObjectPool<CompressionType, S> pool;
    private final CompressionType key;
    private final S state;
    private boolean clean;
    private boolean closed;

    CodecLease(KeyedObjectPool<CompressionType, S> pool, CompressionType key, S state) {
        this.pool = pool;
        this.key = key;
        this.state = state;
    }

    public S state() {
        if (closed) throw new IllegalStateException("Lease already closed");
        return state;
    }

    public void markClean() {
        clean = true;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            if (clean) {
                pool.returnObject(key, state);
            } else {
                pool.invalidateObject(key, state);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to release " + key.label() + " codec state", e);
        }
    }
}
