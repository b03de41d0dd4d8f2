package org.tsappend.datapipeline.api.resources.storage;

import java.io.IOException;
import java.util.Optional;

import org.tsappend.datapipeline.api.dataset.Dataset;

/**
 * Read access to persisted chunked stores.
 */
public interface IDatasetStoreRead {

    /**
     * Loads the store at {@code locator}.
     *
     * @param locator store name relative to this resource's root
     * @return the stored dataset, with chunk and compressor metadata bound to every variable,
     *         or empty if no store exists at the locator
     * @throws IOException if a store exists but cannot be read
     */
    Optional<Dataset> load(String locator) throws IOException;
}
