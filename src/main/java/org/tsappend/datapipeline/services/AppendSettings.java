package org.tsappend.datapipeline.services;

import java.nio.file.Path;
import java.util.List;

import org.tsappend.datapipeline.api.dataset.ChunkShape;
import org.tsappend.datapipeline.api.dataset.CompressionSpec;
import org.tsappend.datapipeline.utils.compression.CompressionCodecFactory;

import com.typesafe.config.Config;

/**
 * Run-independent settings of the append service, read from the {@code tsappend} block of the
 * application configuration.
 *
 * @param chunkShape      chunk sizes, ordering dimension first
 * @param compression     compressor for every stored variable
 * @param outputDirectory directory the output store is written into
 * @param stagingRoot     parent of staging directories, {@code null} for the system temp directory
 */
public record AppendSettings(ChunkShape chunkShape, CompressionSpec compression, Path outputDirectory,
                             Path stagingRoot) {

    /**
     * @param config application configuration (containing {@code tsappend.*})
     * @return the settings
     * @throws com.typesafe.config.ConfigException if a required key is missing or mistyped
     */
    public static AppendSettings fromConfig(Config config) {
        Config root = config.getConfig("tsappend");
        Config pipeline = root.getConfig("pipeline");
        List<Integer> sizes = pipeline.getIntList("chunk-shape");
        ChunkShape chunkShape = ChunkShape.of(sizes.stream().mapToInt(Integer::intValue).toArray());
        CompressionSpec compression = CompressionCodecFactory.specFrom(pipeline);
        Path outputDirectory = Path.of(root.getString("output.directory"));
        String stagingDir = root.getString("staging.directory");
        return new AppendSettings(chunkShape, compression, outputDirectory,
                stagingDir.isBlank() ? null : Path.of(stagingDir));
    }
}
