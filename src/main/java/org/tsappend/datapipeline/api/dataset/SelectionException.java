package org.tsappend.datapipeline.api.dataset;

import org.tsappend.datapipeline.api.DatasetPipelineException;

/**
 * Thrown when a requested variable is absent from the dataset it is selected from.
 */
public class SelectionException extends DatasetPipelineException {

    public SelectionException(String message) {
        super(message);
    }
}
