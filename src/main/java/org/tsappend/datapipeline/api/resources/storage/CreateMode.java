package org.tsappend.datapipeline.api.resources.storage;

/**
 * How a store writer treats an existing destination.
 */
public enum CreateMode {
    /** Fail with {@link WriteConflictException} if the destination exists. */
    EXCLUSIVE,
    /** Replace the destination atomically if it exists. */
    OVERWRITE
}
