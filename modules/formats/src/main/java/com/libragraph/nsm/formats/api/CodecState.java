package com.libragraph.nsm.formats.api;

/**
 * Reusable, expensive-to-build codec state (compression contexts, deflaters,
 * scratch buffers). Instances are pooled per algorithm and are only ever used
 * by one thread at a time.
 */
public interface CodecState {

    /**
     * Clears all residual state so the next frame starts from scratch.
     * Called whenever the state is returned to its pool.
     */
    void reset();

    /**
     * Releases native resources. The state is unusable afterwards.
     */
    default void destroy() {
    }
}
