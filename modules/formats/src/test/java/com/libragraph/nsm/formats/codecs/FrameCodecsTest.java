package com.libragraph.nsm.formats.codecs;

import com.libragraph.nsm.formats.api.FrameCodec;
import com.libragraph.nsm.formats.api.FrameDecoder;
import com.libragraph.nsm.formats.api.FrameEncoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameCodecsTest {

    static Stream<FrameCodec> codecs() {
        return Stream.of(new ZstdFrameCodec(), new DeflateFrameCodec(), new Bzip2FrameCodec());
    }

    @ParameterizedTest
    @MethodSource("codecs")
    void shouldCompressAndDecompress(FrameCodec codec) throws Exception {
        byte[] original = ("Hello, World! ".repeat(100) + "This is test content that should compress well.")
                .getBytes(StandardCharsets.UTF_8);

        byte[] compressed = encode(codec.newEncoder(), original);
        assertThat(compressed.length).isLessThan(original.length);

        assertThat(decode(codec.newDecoder(), compressed)).isEqualTo(original);
    }

    @ParameterizedTest
    @MethodSource("codecs")
    void shouldRoundTripWithDifferentContent(FrameCodec codec) throws Exception {
        byte[] random = new byte[300_000];
        new Random(42).nextBytes(random);
        byte[][] testCases = {
                new byte[0],
                "Short".getBytes(StandardCharsets.UTF_8),
                "A".repeat(1000).getBytes(StandardCharsets.UTF_8),
                random,
        };

        FrameEncoder encoder = codec.newEncoder();
        FrameDecoder decoder = codec.newDecoder();
        for (byte[] original : testCases) {
            byte[] compressed = encode(encoder, original);
            encoder.reset();
            assertThat(decode(decoder, compressed)).isEqualTo(original);
            decoder.reset();
        }
        encoder.destroy();
        decoder.destroy();
    }

    @ParameterizedTest
    @MethodSource("codecs")
    void shouldProduceIndependentFrames(FrameCodec codec) throws Exception {
        FrameEncoder encoder = codec.newEncoder();
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try (OutputStream frame = encoder.open(sink)) {
            frame.write("first frame ".repeat(50).getBytes(StandardCharsets.UTF_8));
        }
        int firstLength = sink.size();
        encoder.reset();
        try (OutputStream frame = encoder.open(sink)) {
            frame.write("second frame".getBytes(StandardCharsets.UTF_8));
        }
        byte[] all = sink.toByteArray();
        byte[] second = Arrays.copyOfRange(all, firstLength, all.length);

        assertThat(new String(decode(codec.newDecoder(), second), StandardCharsets.UTF_8))
                .isEqualTo("second frame");
    }

    @ParameterizedTest
    @MethodSource("codecs")
    void shouldNotCloseTheSink(FrameCodec codec) throws Exception {
        boolean[] closed = {false};
        OutputStream sink = new ByteArrayOutputStream() {
            @Override
            public void close() {
                closed[0] = true;
            }
        };
        try (OutputStream frame = codec.newEncoder().open(sink)) {
            frame.write(1);
        }
        assertThat(closed[0]).isFalse();
    }

    @ParameterizedTest
    @MethodSource("codecs")
    void shouldFailOnTruncatedFrame(FrameCodec codec) throws Exception {
        byte[] original = new byte[100_000];
        new Random(7).nextBytes(original);
        byte[] compressed = encode(codec.newEncoder(), original);
        byte[] truncated = Arrays.copyOf(compressed, compressed.length / 2);

        assertThatThrownBy(() -> decode(codec.newDecoder(), truncated)).isInstanceOf(IOException.class);
    }

    @Test
    void shouldRejectOutOfRangeLevels() {
        assertThatIllegalArgumentException().isThrownBy(() -> new ZstdFrameCodec(0));
        assertThatIllegalArgumentException().isThrownBy(() -> new ZstdFrameCodec(23));
        assertThatIllegalArgumentException().isThrownBy(() -> new DeflateFrameCodec(10));
        assertThatIllegalArgumentException().isThrownBy(() -> new Bzip2FrameCodec(0));
    }

    private static byte[] encode(FrameEncoder encoder, byte[] data) throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try (OutputStream frame = encoder.open(sink)) {
            frame.write(data);
        }
        return sink.toByteArray();
    }

    private static byte[] decode(FrameDecoder decoder, byte[] frame) throws IOException {
        try (InputStream in = decoder.open(new ByteArrayInputStream(frame))) {
            return in.readAllBytes();
        }
    }
}
