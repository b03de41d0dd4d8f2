package org.tsappend.datapipeline.staging;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Materializes remote objects into a local staging directory.
 * <p>
 * {@code url} is treated as a key prefix: every object whose key starts with it is staged. The
 * part of the prefix up to and including its last {@code /} is stripped from each key, so
 * staging {@code s3://bucket/stores/era5} places {@code stores/era5/dataset.json} at
 * {@code {target}/era5/dataset.json}.
 */
public interface IStagingClient {

    /**
     * @param url       prefix URL to stage
     * @param targetDir existing, empty directory to stage into
     * @return number of files staged
     * @throws IOException              if listing or transferring fails
     * @throws IllegalArgumentException if the URL scheme is not handled by this client
     */
    int stage(String url, Path targetDir) throws IOException;
}
