/**
 * Hashing and stream utilities shared by the format codec and the engine.
 *
 * <p>All checksums are BLAKE3-256 via Apache Commons Codec.
 */
package com.libragraph.nsm.util;
