package org.tsappend.datapipeline.api.resources.storage;

import org.tsappend.datapipeline.api.DatasetPipelineException;

/**
 * Thrown when a glob pattern matches no input file in a staging area.
 */
public class NoMatchException extends DatasetPipelineException {

    public NoMatchException(String message) {
        super(message);
    }
}
