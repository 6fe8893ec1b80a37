package com.libragraph.nsm.formats.compress;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.formats.api.FrameCodec;
import com.libragraph.nsm.formats.api.FrameDecoder;
import com.libragraph.nsm.formats.api.FrameEncoder;
import com.libragraph.nsm.formats.codecs.ZstdFrameCodec;
import com.libragraph.nsm.formats.registry.CodecRegistry;
import com.libragraph.nsm.types.CompressionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompressionEngineTest {

    private CompressionEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) engine.close();
    }

    @ParameterizedTest
    @EnumSource(CompressionType.class)
    void shouldRoundTripEveryAlgorithm(CompressionType type) {
        engine = new CompressionEngine(CodecRegistry.defaults(ZstdFrameCodec.DEFAULT_LEVEL), 2);
        byte[] original = "the quick brown fox jumps over the lazy dog\n".repeat(500)
                .getBytes(StandardCharsets.UTF_8);

        ByteArrayOutputStream frame = new ByteArrayOutputStream();
        long written = engine.compress(frame, new ByteArrayInputStream(original), type);
        assertThat(written).isEqualTo(frame.size()).isLessThan(original.length);

        ByteArrayOutputStream restored = new ByteArrayOutputStream();
        long restoredBytes = engine.decompress(restored, new ByteArrayInputStream(frame.toByteArray()), type);
        assertThat(restoredBytes).isEqualTo(original.length);
        assertThat(restored.toByteArray()).isEqualTo(original);
        assertThat(engine.activeOperations()).isZero();
    }

    @Test
    void shouldReuseCodecStateAcrossFrames() {
        engine = new CompressionEngine(CodecRegistry.defaults(3), 1);
        for (int i = 0; i < 5; i++) {
            engine.compress(new ByteArrayOutputStream(), new ByteArrayInputStream(new byte[]{(byte) i}),
                    CompressionType.ZSTD);
        }
        assertThat(engine.idleEncoders(CompressionType.ZSTD)).isEqualTo(1);
    }

    @Test
    void shouldDefaultToHalfTheProcessors() {
        int expected = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        engine = new CompressionEngine(CodecRegistry.defaults(3));
        assertThat(engine.permits()).isEqualTo(expected);
        assertThat(CompressionEngine.defaultPermits()).isEqualTo(expected);
    }

    @Test
    void shouldBoundConcurrentFrameOperations() throws Exception {
        SlowCodec slow = new SlowCodec();
        CodecRegistry registry = CodecRegistry.defaults(3);
        registry.register(slow);
        engine = new CompressionEngine(registry, 2);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> engine.compress(new ByteArrayOutputStream(),
                        new ByteArrayInputStream(new byte[64]), CompressionType.DEFLATE)));
            }
            for (Future<Long> f : futures) {
                assertThat(f.get(30, TimeUnit.SECONDS)).isEqualTo(64L);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(slow.peak.get()).isBetween(1, 2);
        assertThat(engine.peakActiveOperations()).isBetween(1, 2);
        assertThat(engine.activeOperations()).isZero();
    }

    @Test
    void shouldRejectAlgorithmWithoutCodec() {
        engine = new CompressionEngine(new CodecRegistry(List.of(new ZstdFrameCodec())), 1);

        assertThatThrownBy(() -> engine.compress(new ByteArrayOutputStream(),
                new ByteArrayInputStream(new byte[1]), CompressionType.BZIP2))
                .isInstanceOfSatisfying(ArchiveException.class,
                        e -> assertThat(e.error()).isEqualTo(ArchiveError.UNSUPPORTED_ALGORITHM));
        assertThat(engine.activeOperations()).isZero();
    }

    @Test
    void shouldWrapSourceFailureAndDiscardState() {
        engine = new CompressionEngine(CodecRegistry.defaults(3), 1);
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }
        };

        assertThatThrownBy(() -> engine.compress(new ByteArrayOutputStream(), failing, CompressionType.ZSTD))
                .isInstanceOfSatisfying(ArchiveException.class, e -> {
                    assertThat(e.error()).isEqualTo(ArchiveError.ARCHIVE_WRITE_FAILURE);
                    assertThat(e.getMessage()).contains("compress zstd").contains("disk gone");
                    assertThat(e.retryable()).isTrue();
                });
        assertThat(engine.idleEncoders(CompressionType.ZSTD)).isZero();
        assertThat(engine.activeOperations()).isZero();
    }

    @Test
    void shouldWrapCorruptFrameAsReadFailure() {
        engine = new CompressionEngine(CodecRegistry.defaults(3), 1);
        byte[] garbage = "definitely not a zstd frame".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> engine.decompress(new ByteArrayOutputStream(),
                new ByteArrayInputStream(garbage), CompressionType.ZSTD))
                .isInstanceOfSatisfying(ArchiveException.class,
                        e -> assertThat(e.error()).isEqualTo(ArchiveError.ARCHIVE_READ_FAILURE));
        assertThat(engine.idleDecoders(CompressionType.ZSTD)).isZero();
    }

    @Test
    void shouldRestoreInterruptFlagWhenInterruptedWaitingForPermit() {
        engine = new CompressionEngine(CodecRegistry.defaults(3), 1);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> engine.compress(new ByteArrayOutputStream(),
                    new ByteArrayInputStream(new byte[1]), CompressionType.ZSTD))
                    .isInstanceOfSatisfying(ArchiveException.class,
                            e -> assertThat(e.error()).isEqualTo(ArchiveError.ARCHIVE_WRITE_FAILURE));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    /**
     * Pass-through codec registered under DEFLATE that records how many
     * frames are open at once.
     */
    private static final class SlowCodec implements FrameCodec {
        final AtomicInteger open = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();

        @Override
        public CompressionType type() {
            return CompressionType.DEFLATE;
        }

        @Override
        public FrameEncoder newEncoder() {
            return new FrameEncoder() {
                @Override
                public OutputStream open(OutputStream sink) {
                    peak.accumulateAndGet(open.incrementAndGet(), Math::max);
                    return new FilterOutputStream(sink) {
                        @Override
                        public void close() throws IOException {
                            try {
                                Thread.sleep(50);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                throw new IOException(e);
                            } finally {
                                open.decrementAndGet();
                            }
                            flush();
                        }
                    };
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
                public InputStream open(InputStream source) {
                    return source;
                }

                @Override
                public void reset() {
                }
            };
        }
    }
}
