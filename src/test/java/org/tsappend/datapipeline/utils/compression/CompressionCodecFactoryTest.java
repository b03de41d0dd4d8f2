package org.tsappend.datapipeline.utils.compression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tsappend.datapipeline.api.dataset.CompressionSpec;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class CompressionCodecFactoryTest {

    @Test
    void createsZstdAtTheRequestedLevel() {
        ICompressionCodec codec = CompressionCodecFactory.create(new CompressionSpec("ZSTD", 19));

        assertThat(codec).isInstanceOf(ZstdCompressionCodec.class);
        assertThat(codec.getLevel()).isEqualTo(19);
    }

    @Test
    void rejectsOutOfRangeZstdLevel() {
        assertThatThrownBy(() -> CompressionCodecFactory.create(new CompressionSpec("zstd", 99)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("99");
    }

    @Test
    void rejectsUnknownCodec() {
        assertThatThrownBy(() -> CompressionCodecFactory.create(new CompressionSpec("lz4", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lz4");
    }

    @Test
    void readsTheCompressionBlock() {
        CompressionSpec spec = CompressionCodecFactory.specFrom(
                ConfigFactory.parseString("compression { codec = zstd, level = 7 }"));

        assertThat(spec).isEqualTo(new CompressionSpec("zstd", 7));
        assertThat(CompressionCodecFactory.specFrom(ConfigFactory.parseString("compression.codec = none")))
                .isEqualTo(new CompressionSpec("none", 0));
    }

    @Test
    void zstdStreamsRoundTrip() throws IOException {
        ICompressionCodec codec = new ZstdCompressionCodec(3);
        byte[] payload = "0123456789".repeat(200).getBytes(StandardCharsets.UTF_8);

        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (OutputStream out = codec.wrapOutputStream(compressed)) {
            out.write(payload);
        }
        byte[] restored;
        try (InputStream in = codec.wrapInputStream(new ByteArrayInputStream(compressed.toByteArray()))) {
            restored = in.readAllBytes();
        }

        assertThat(compressed.size()).isLessThan(payload.length);
        assertThat(restored).isEqualTo(payload);
    }
}
