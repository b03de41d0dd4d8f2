package org.tsappend.datapipeline.api.resources.storage;

import java.io.IOException;
import java.nio.file.Path;

import org.tsappend.datapipeline.api.dataset.Dataset;

/**
 * Parses a single input file into a dataset. One implementation exists per file format.
 */
@FunctionalInterface
public interface IDatasetFileReader {

    Dataset read(Path file) throws IOException;
}
