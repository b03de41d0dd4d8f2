package org.tsappend.datapipeline.api.resources.storage;

import org.tsappend.datapipeline.api.DatasetPipelineException;

/**
 * Thrown by a store writer in {@link CreateMode#EXCLUSIVE} mode when the destination already
 * holds a store. The destination is left exactly as it was.
 */
public class WriteConflictException extends DatasetPipelineException {

    public WriteConflictException(String message) {
        super(message);
    }
}
