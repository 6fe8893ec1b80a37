package com.libragraph.nsm.formats.api;

import com.libragraph.nsm.types.CompressionType;

/**
 * Plugin for one compression algorithm. Produces the per-frame encoder and
 * decoder states that the compression engine pools and reuses.
 *
 * Every frame a codec writes must be decodable on its own, without any
 * state from neighbouring frames.
 */
public interface FrameCodec {

    /**
     * The algorithm this codec implements. Recorded in the archive header.
     */
    CompressionType type();

    /**
     * Creates a fresh encoder state. Called by the pool only when no idle
     * state is available.
     */
    FrameEncoder newEncoder();

    /**
     * Creates a fresh decoder state.
     */
    FrameDecoder newDecoder();
}
