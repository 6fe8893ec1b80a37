package com.libragraph.nsm.formats.archive;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.types.CompressionType;
import com.libragraph.nsm.types.EncryptionType;
import com.libragraph.nsm.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeaderCodecTest {

    private static final ArchiveHeader HEADER = new ArchiveHeader(
            ArchiveHeader.CURRENT_VERSION, CompressionType.ZSTD, EncryptionType.NONE,
            1_700_000_000_000L, 164, 120, ContentHash.of(new byte[]{1, 2, 3}));

    @Test
    void shouldEncodeFixedSizeBigEndianLayout() {
        byte[] bytes = HeaderCodec.encode(HEADER);

        assertThat(bytes).hasSize(64);
        assertThat(bytes).startsWith(0x4E, 0x53, 0x4D, 0x01, 0x00, 0x02, 0x01, 0x00);
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        assertThat(buf.getLong(8)).isEqualTo(1_700_000_000_000L);
        assertThat(buf.getLong(16)).isEqualTo(164);
        assertThat(buf.getLong(24)).isEqualTo(120);
    }

    @Test
    void shouldDecodeWhatWasEncoded() {
        ArchiveHeader decoded = HeaderCodec.decode(HeaderCodec.encode(HEADER));

        assertThat(decoded).isEqualTo(HEADER);
        assertThat(decoded.dataBlockLength()).isEqualTo(100);
        assertThat(decoded.encrypted()).isFalse();
    }

    @Test
    void shouldRejectRandomBytesAsInvalidFormat() {
        byte[] noise = new byte[128];
        new Random(1234).nextBytes(noise);
        noise[0] = 0x00; // never the magic

        assertThatThrownBy(() -> HeaderCodec.decode(noise))
                .isInstanceOf(ArchiveException.class)
                .extracting(e -> ((ArchiveException) e).error())
                .isEqualTo(ArchiveError.INVALID_FORMAT);
    }

    @Test
    void shouldRejectShortInput() {
        assertError(() -> HeaderCodec.decode(new byte[10]), ArchiveError.INVALID_FORMAT);
    }

    @Test
    void shouldRejectVersionZero() {
        byte[] bytes = HeaderCodec.encode(HEADER);
        bytes[4] = 0;
        bytes[5] = 0;
        assertError(() -> HeaderCodec.decode(bytes), ArchiveError.INVALID_FORMAT);
    }

    @Test
    void shouldRejectNewerVersion() {
        byte[] bytes = HeaderCodec.encode(HEADER);
        bytes[5] = 3;
        assertError(() -> HeaderCodec.decode(bytes), ArchiveError.UNSUPPORTED_VERSION);
    }

    @Test
    void shouldAcceptVersionOne() {
        byte[] bytes = HeaderCodec.encode(HEADER);
        bytes[5] = 1;
        ArchiveHeader decoded = HeaderCodec.decode(bytes);
        assertThat(decoded.version()).isEqualTo(1);
        assertThat(decoded.supportsSearchSection()).isFalse();
    }

    @Test
    void shouldRejectUnknownAlgorithmTags() {
        byte[] badCompression = HeaderCodec.encode(HEADER);
        badCompression[6] = 9;
        assertError(() -> HeaderCodec.decode(badCompression), ArchiveError.UNSUPPORTED_ALGORITHM);

        byte[] badEncryption = HeaderCodec.encode(HEADER);
        badEncryption[7] = 7;
        assertError(() -> HeaderCodec.decode(badEncryption), ArchiveError.UNSUPPORTED_ALGORITHM);
    }

    @Test
    void shouldValidateLayoutAgainstFileSize() {
        HeaderCodec.validateLayout(HEADER, 284);

        assertError(() -> HeaderCodec.validateLayout(HEADER, 285), ArchiveError.INVALID_FORMAT);
        assertError(() -> HeaderCodec.validateLayout(HEADER, 200), ArchiveError.INVALID_FORMAT);
        ArchiveHeader insideHeader = new ArchiveHeader(2, CompressionType.ZSTD, EncryptionType.NONE,
                0, 10, 274, HEADER.dataChecksum());
        assertError(() -> HeaderCodec.validateLayout(insideHeader, 284), ArchiveError.INVALID_FORMAT);
    }

    static void assertError(Runnable call, ArchiveError expected) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(ArchiveException.class, e -> assertThat(e.error()).isEqualTo(expected));
    }
}
