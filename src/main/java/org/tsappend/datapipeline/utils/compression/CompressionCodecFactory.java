package org.tsappend.datapipeline.utils.compression;

import java.util.Locale;

import org.tsappend.datapipeline.api.dataset.CompressionSpec;

import com.typesafe.config.Config;

/**
 * Creates {@link ICompressionCodec} instances from a {@link CompressionSpec} or from a
 * configuration block of the form:
 * <pre>
 * compression {
 *   codec = "zstd"
 *   level = 19
 * }
 * </pre>
 */
public final class CompressionCodecFactory {

    private CompressionCodecFactory() {
    }

    /**
     * @param spec codec name and level
     * @return the codec
     * @throws IllegalArgumentException if the codec name is unknown or the level invalid
     */
    public static ICompressionCodec create(CompressionSpec spec) {
        return switch (spec.codec().toLowerCase(Locale.ROOT)) {
            case ZstdCompressionCodec.NAME -> new ZstdCompressionCodec(spec.level());
            case NoneCompressionCodec.NAME -> new NoneCompressionCodec();
            default -> throw new IllegalArgumentException("Unsupported compression codec: " + spec.codec()
                    + " (supported: " + ZstdCompressionCodec.NAME + ", " + NoneCompressionCodec.NAME + ")");
        };
    }

    /**
     * Reads the {@code compression} block of {@code options}.
     *
     * @param options configuration containing {@code compression.codec} and {@code compression.level}
     * @return the spec described by the block
     */
    public static CompressionSpec specFrom(Config options) {
        Config compression = options.getConfig("compression");
        String codec = compression.getString("codec");
        int level = compression.hasPath("level") ? compression.getInt("level") : 0;
        return new CompressionSpec(codec, level);
    }
}
