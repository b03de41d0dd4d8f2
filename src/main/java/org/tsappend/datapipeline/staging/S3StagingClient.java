package org.tsappend.datapipeline.staging;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Stages objects from an S3 prefix ({@code s3://bucket/prefix}).
 * <p>
 * The {@link S3Client} is supplied by the caller and owned by it; this class never creates or
 * closes one.
 */
public class S3StagingClient implements IStagingClient {

    public static final String SCHEME = "s3";

    private static final Logger log = LoggerFactory.getLogger(S3StagingClient.class);

    private final S3Client s3Client;

    public S3StagingClient(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public int stage(String url, Path targetDir) throws IOException {
        URI uri = URI.create(url);
        if (!SCHEME.equals(uri.getScheme())) {
            throw new IllegalArgumentException("Expected s3 URL, got " + uri.getScheme());
        }
        String bucket = uri.getHost();
        String prefix = uri.getPath() == null ? "" : uri.getPath().replaceFirst("^/+", "");
        String strip = StagingPaths.stripPrefix(prefix);

        ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();
        int staged = 0;
        try {
            for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
                String key = object.key();
                if (key.endsWith("/")) {
                    continue;
                }
                Path destination = StagingPaths.destination(targetDir, key, strip);
                Files.createDirectories(destination.getParent());
                log.debug("Downloading s3://{}/{} to {}", bucket, key, destination);
                s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build(),
                        ResponseTransformer.toFile(destination));
                staged++;
            }
        } catch (SdkException e) {
            throw new IOException("Failed to stage " + url + ": " + e.getMessage(), e);
        }
        log.info("Staged {} object(s) from {}", staged, url);
        return staged;
    }
}
