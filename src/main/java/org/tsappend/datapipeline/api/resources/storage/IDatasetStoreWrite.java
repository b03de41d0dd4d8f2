package org.tsappend.datapipeline.api.resources.storage;

import java.io.IOException;

import org.tsappend.datapipeline.api.dataset.EncodedDataset;

/**
 * Write access to persisted chunked stores.
 * <p>
 * Implementations must publish a store atomically: readers see either the previous store (or
 * nothing) or the complete new one, never a partial write.
 */
public interface IDatasetStoreWrite {

    /**
     * Persists {@code encoded} at {@code locator}.
     *
     * @param encoded dataset with chunk geometry and compressor bound to every variable
     * @param locator store name relative to this resource's root
     * @param mode    how to treat an existing destination
     * @throws WriteConflictException if {@code mode} is {@link CreateMode#EXCLUSIVE} and the
     *                                destination exists
     * @throws IOException            on any I/O failure; the destination is left untouched
     */
    void write(EncodedDataset encoded, String locator, CreateMode mode) throws IOException;
}
