package org.tsappend.datapipeline.api.dataset;

import org.tsappend.datapipeline.api.DatasetPipelineException;

/**
 * Thrown when two datasets (or a dataset and one of its parts) disagree on dimensions,
 * dimension lengths or variable sets outside the dimension being concatenated.
 */
public class AxisMismatchException extends DatasetPipelineException {

    public AxisMismatchException(String message) {
        super(message);
    }
}
