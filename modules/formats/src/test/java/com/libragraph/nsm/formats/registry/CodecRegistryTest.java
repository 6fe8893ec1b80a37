package com.libragraph.nsm.formats.registry;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.formats.codecs.DeflateFrameCodec;
import com.libragraph.nsm.formats.codecs.ZstdFrameCodec;
import com.libragraph.nsm.types.CompressionType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodecRegistryTest {

    @Test
    void shouldRegisterEveryBuiltInCodec() {
        CodecRegistry registry = CodecRegistry.defaults(5);

        assertThat(registry.supported()).containsExactlyInAnyOrder(CompressionType.values());
        assertThat(registry.require(CompressionType.ZSTD))
                .isInstanceOfSatisfying(ZstdFrameCodec.class, c -> assertThat(c.level()).isEqualTo(5));
    }

    @Test
    void shouldFailForMissingCodec() {
        CodecRegistry registry = new CodecRegistry(List.of(new DeflateFrameCodec()));

        assertThat(registry.find(CompressionType.ZSTD)).isEmpty();
        assertThatThrownBy(() -> registry.require(CompressionType.ZSTD))
                .isInstanceOfSatisfying(ArchiveException.class,
                        e -> assertThat(e.error()).isEqualTo(ArchiveError.UNSUPPORTED_ALGORITHM));
    }
}
