package org.tsappend.datapipeline.api.dataset;

import org.tsappend.datapipeline.api.DatasetPipelineException;

/**
 * Thrown when the ordering dimension has no unambiguous ordinal coordinate bound to it alone.
 */
public class NoOrderingCoordinateException extends DatasetPipelineException {

    public NoOrderingCoordinateException(String message) {
        super(message);
    }
}
