package org.tsappend.datapipeline.staging;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A temporary local directory holding staged files. Closing it deletes the directory and
 * everything in it; closing twice is a no-op.
 */
public final class StagingArea implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(StagingArea.class);

    private final Path directory;
    private boolean released;

    private StagingArea(Path directory) {
        this.directory = directory;
    }

    /**
     * Creates a fresh staging directory.
     *
     * @param parent directory to create it in, or {@code null} for the system temp directory
     * @return the staging area
     */
    public static StagingArea create(Path parent) throws IOException {
        Path directory = parent == null
                ? Files.createTempDirectory("tsappend-stage-")
                : Files.createTempDirectory(Files.createDirectories(parent), "tsappend-stage-");
        log.info("Created data staging directory: {}", directory);
        return new StagingArea(directory);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void close() throws IOException {
        if (released) {
            return;
        }
        log.info("Cleaning up staging dir: {}", directory);
        if (Files.exists(directory)) {
            try (Stream<Path> walk = Files.walk(directory)) {
                List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
                for (Path path : paths) {
                    Files.delete(path);
                }
            }
        }
        released = true;
    }
}
