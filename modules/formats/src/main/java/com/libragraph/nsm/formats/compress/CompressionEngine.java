package com.libragraph.nsm.formats.compress;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.formats.api.FrameDecoder;
import com.libragraph.nsm.formats.api.FrameEncoder;
import com.libragraph.nsm.formats.registry.CodecRegistry;
import com.libragraph.nsm.types.CompressionType;
import org.apache.commons.io.output.CountingOutputStream;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams one frame at a time through a pooled codec state.
 *
 * <p>A fair semaphore bounds how many frames are being compressed or
 * decompressed at once across the whole process; a permit is held for the
 * full streaming operation and released in {@code finally}. Codec states are
 * checked out of a {@link CodecStatePool} for the same span.
 *
 * <p>Callers own both streams; the engine never closes them.
 */
public class CompressionEngine implements AutoCloseable {

    private static final Logger log = Logger.getLogger(CompressionEngine.class);

    private final CodecRegistry registry;
    private final Semaphore permits;
    private final int permitCount;
    private final CodecStatePool states;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public CompressionEngine(CodecRegistry registry) {
        this(registry, defaultPermits());
    }

    public CompressionEngine(CodecRegistry registry, int permitCount) {
        if (permitCount < 1) {
            throw new IllegalArgumentException("permitCount must be >= 1, got: " + permitCount);
        }
        this.registry = registry;
        this.permitCount = permitCount;
        this.permits = new Semaphore(permitCount, true);
        this.states = new CodecStatePool(registry, permitCount);
        log.infof("Compression engine ready: %d permits, codecs %s", permitCount, registry.supported());
    }

    /**
     * Half the available processors, at least one.
     */
    public static int defaultPermits() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    /**
     * Compresses all of {@code source} into one frame on {@code destination}.
     *
     * @return number of compressed bytes written
     */
    public long compress(OutputStream destination, InputStream source, CompressionType algorithm) {
        registry.require(algorithm);
        acquire(ArchiveError.ARCHIVE_WRITE_FAILURE, "compress");
        try (CodecLease<FrameEncoder> lease = states.borrowEncoder(algorithm)) {
            CountingOutputStream counted = new CountingOutputStream(destination);
            try (OutputStream frame = lease.state().open(counted)) {
                source.transferTo(frame);
            }
            lease.markClean();
            return counted.getByteCount();
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_WRITE_FAILURE,
                    "compress " + algorithm.label() + " frame failed: " + e.getMessage(), e);
        } finally {
            release();
        }
    }

    /**
     * Decodes one frame read from {@code source} onto {@code destination}.
     *
     * @return number of uncompressed bytes written
     */
    public long decompress(OutputStream destination, InputStream source, CompressionType algorithm) {
        registry.require(algorithm);
        acquire(ArchiveError.ARCHIVE_READ_FAILURE, "decompress");
        try (CodecLease<FrameDecoder> lease = states.borrowDecoder(algorithm)) {
            long written;
            try (InputStream frame = lease.state().open(source)) {
                written = frame.transferTo(destination);
            }
            lease.markClean();
            return written;
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE,
                    "decompress " + algorithm.label() + " frame failed: " + e.getMessage(), e);
        } finally {
            release();
        }
    }

    public int permits() {
        return permitCount;
    }

    public int activeOperations() {
        return active.get();
    }

    /**
     * Highest number of simultaneous frame operations observed so far.
     */
    public int peakActiveOperations() {
        return peak.get();
    }

    int idleEncoders(CompressionType type) {
        return states.idleEncoders(type);
    }

    int idleDecoders(CompressionType type) {
        return states.idleDecoders(type);
    }

    private void acquire(ArchiveError error, String operation) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveException(error, "Interrupted waiting for a " + operation + " permit", e);
        }
        int now = active.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
    }

    private void release() {
        active.decrementAndGet();
        permits.release();
    }

    @Override
    public void close() {
        states.close();
    }
}
