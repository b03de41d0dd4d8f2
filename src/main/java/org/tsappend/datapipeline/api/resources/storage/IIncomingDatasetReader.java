package org.tsappend.datapipeline.api.resources.storage;

import java.io.IOException;
import java.nio.file.Path;

import org.tsappend.datapipeline.api.dataset.Dataset;

/**
 * Reads freshly staged input files into one dataset.
 */
public interface IIncomingDatasetReader {

    /**
     * Reads every file under {@code directory} matching {@code globPattern} and concatenates
     * them along {@code orderingDim}, sorted by the ordering coordinate.
     *
     * @param directory   staging directory
     * @param globPattern glob relative to {@code directory} (e.g. {@code *.json})
     * @param orderingDim name of the ordering dimension
     * @return the combined dataset
     * @throws NoMatchException if the pattern matches no file
     * @throws IOException      if a matching file cannot be read
     */
    Dataset read(Path directory, String globPattern, String orderingDim) throws IOException;
}
