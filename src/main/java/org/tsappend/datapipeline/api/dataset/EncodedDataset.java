package org.tsappend.datapipeline.api.dataset;

import java.util.Objects;

/**
 * A dataset ready for a store writer: every variable carries chunk geometry and a compressor.
 *
 * @param dataset          the fully assembled dataset
 * @param writeEmptyChunks whether chunks holding only the fill value are written
 */
public record EncodedDataset(Dataset dataset, boolean writeEmptyChunks) {

    public EncodedDataset {
        Objects.requireNonNull(dataset, "dataset");
    }
}
