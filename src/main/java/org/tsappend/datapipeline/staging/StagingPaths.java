package org.tsappend.datapipeline.staging;

import java.nio.file.Path;

/**
 * Key-to-path mapping shared by the staging clients.
 */
final class StagingPaths {

    private StagingPaths() {
    }

    /**
     * Returns the part of {@code prefix} that is stripped from every staged key: everything up to
     * and including its last {@code /}, or nothing for a prefix at the bucket root.
     */
    static String stripPrefix(String prefix) {
        int strip = prefix.lastIndexOf('/');
        return strip != -1 ? prefix.substring(0, strip + 1) : "";
    }

    /**
     * Resolves a staged key below {@code targetDir}.
     *
     * @throws IllegalArgumentException if the key would land outside {@code targetDir}
     */
    static Path destination(Path targetDir, String key, String stripPrefix) {
        String relative = key.startsWith(stripPrefix) ? key.substring(stripPrefix.length()) : key;
        Path destination = targetDir.resolve(relative).normalize();
        if (!destination.startsWith(targetDir) || destination.equals(targetDir)) {
            throw new IllegalArgumentException("Object key escapes staging directory: " + key);
        }
        return destination;
    }
}
