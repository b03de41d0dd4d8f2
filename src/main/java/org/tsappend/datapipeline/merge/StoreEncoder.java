package org.tsappend.datapipeline.merge;

import org.tsappend.datapipeline.api.dataset.CompressionSpec;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.EncodedDataset;
import org.tsappend.datapipeline.utils.compression.CompressionCodecFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds one compressor to every variable and marks the dataset ready for the store writer.
 * <p>
 * Chunks consisting solely of the fill value are flagged to be skipped by the writer.
 */
public class StoreEncoder {

    private static final Logger log = LoggerFactory.getLogger(StoreEncoder.class);

    /**
     * @param dataset chunk-planned dataset
     * @param codec   compressor for every variable
     * @return the encoded dataset
     * @throws IllegalArgumentException if the codec is not supported
     * @throws IllegalStateException    if a variable has no chunk plan
     */
    public EncodedDataset encode(Dataset dataset, CompressionSpec codec) {
        // Fail here rather than in the writer, after the staging work is done
        CompressionCodecFactory.create(codec);
        Dataset encoded = dataset.mapVariables(v -> {
            if (v.getChunks() == null) {
                throw new IllegalStateException("Variable '" + v.getName() + "' has no chunk plan");
            }
            return v.withCompressor(codec);
        });
        log.info("Encoding {} variable(s) with compressor {}", encoded.getVariableNames().size(), codec);
        return new EncodedDataset(encoded, false);
    }
}
