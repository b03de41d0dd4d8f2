package org.tsappend.datapipeline.resources.storage;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.resources.storage.IDatasetFileReader;
import org.tsappend.datapipeline.api.resources.storage.IIncomingDatasetReader;
import org.tsappend.datapipeline.api.resources.storage.NoMatchException;
import org.tsappend.datapipeline.merge.DatasetMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads all files matching a glob in a staging directory and concatenates them.
 * <p>
 * The glob is matched against paths relative to the directory, so {@code *.json} only matches
 * top-level files while {@code 2024/*.json} reaches into a subdirectory. Files are read in path
 * order and the concatenation is stably sorted by the ordering coordinate.
 */
public class GlobDatasetReader implements IIncomingDatasetReader {

    private static final Logger log = LoggerFactory.getLogger(GlobDatasetReader.class);

    private final IDatasetFileReader fileReader;

    public GlobDatasetReader(IDatasetFileReader fileReader) {
        this.fileReader = fileReader;
    }

    @Override
    public Dataset read(Path directory, String globPattern, String orderingDim) throws IOException {
        List<Path> files = match(directory, globPattern);
        if (files.isEmpty()) {
            throw new NoMatchException("No files match '" + globPattern + "' in " + directory);
        }
        log.info("Reading {} input file(s) matching '{}'", files.size(), globPattern);

        Dataset combined = null;
        for (Path file : files) {
            log.debug("Reading input file {}", file);
            Dataset dataset = fileReader.read(file);
            combined = combined == null ? dataset : combined.concat(dataset, orderingDim);
        }
        return DatasetMerger.sortBy(combined, orderingDim);
    }

    static List<Path> match(Path directory, String globPattern) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoMatchException("Input directory does not exist: " + directory);
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(directory.relativize(p)))
                    .sorted()
                    .toList();
        }
    }
}
