package org.tsappend.datapipeline.resources.storage;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.resources.storage.IDatasetFileReader;
import org.tsappend.datapipeline.resources.storage.json.DatasetJson;

/**
 * Reads one input file holding a {@link org.tsappend.datapipeline.resources.storage.json.DatasetDocument}
 * with inline variable data.
 */
public class JsonDatasetFileReader implements IDatasetFileReader {

    @Override
    public Dataset read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return DatasetJson.toDataset(DatasetJson.read(reader), (v, fill) -> {
                throw new IOException("Variable '" + v.name() + "' in " + file + " has no data");
            });
        } catch (IOException e) {
            throw new IOException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
