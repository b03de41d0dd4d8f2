package org.tsappend.datapipeline.staging;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stages files from the local file system ({@code file:///dir/prefix} or a plain path), with
 * the same prefix semantics as {@link S3StagingClient}.
 */
public class LocalStagingClient implements IStagingClient {

    public static final String SCHEME = "file";

    private static final Logger log = LoggerFactory.getLogger(LocalStagingClient.class);

    @Override
    public int stage(String url, Path targetDir) throws IOException {
        String path = toPath(url);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Empty local path in " + url);
        }
        String strip = StagingPaths.stripPrefix(path);
        Path baseDir = Paths.get(strip.isEmpty() ? "." : strip).toAbsolutePath().normalize();
        String namePrefix = path.substring(strip.length());
        if (!Files.isDirectory(baseDir)) {
            throw new IOException("Local source directory does not exist: " + baseDir);
        }

        List<Path> sources;
        try (Stream<Path> walk = Files.walk(baseDir)) {
            sources = walk.filter(Files::isRegularFile)
                    .filter(p -> relativeKey(baseDir, p).startsWith(namePrefix))
                    .sorted()
                    .toList();
        }
        for (Path source : sources) {
            Path destination = StagingPaths.destination(targetDir, relativeKey(baseDir, source), "");
            Files.createDirectories(destination.getParent());
            log.debug("Copying {} to {}", source, destination);
            Files.copy(source, destination);
        }
        log.info("Staged {} file(s) from {}", sources.size(), url);
        return sources.size();
    }

    private static String toPath(String url) {
        if (url.startsWith(SCHEME + ":")) {
            URI uri = URI.create(url);
            String path = uri.getPath();
            // keep the trailing slash: it decides whether the last segment is a prefix
            return path == null ? "" : path;
        }
        return url;
    }

    private static String relativeKey(Path baseDir, Path file) {
        return baseDir.relativize(file).toString().replace(java.io.File.separatorChar, '/');
    }
}
