package org.tsappend.datapipeline.api.dataset;

/**
 * Compressor bound to a stored variable.
 *
 * @param codec codec name as understood by
 *              {@link org.tsappend.datapipeline.utils.compression.CompressionCodecFactory}
 * @param level codec-specific compression level
 */
public record CompressionSpec(String codec, int level) {

    public CompressionSpec {
        if (codec == null || codec.isBlank()) {
            throw new IllegalArgumentException("Codec name cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return codec + ":" + level;
    }
}
