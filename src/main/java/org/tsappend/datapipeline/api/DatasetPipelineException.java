package org.tsappend.datapipeline.api;

/**
 * Base class of all failures that abort an append run.
 * <p>
 * These are RuntimeExceptions because every one of them indicates an input or destination
 * problem that the run cannot recover from: the pipeline never retries and never commits a
 * partial result. Callers (the CLI) catch this type once at the top level and map it to a
 * non-zero exit code.
 */
public class DatasetPipelineException extends RuntimeException {

    /**
     * @param message description of the failure
     */
    public DatasetPipelineException(String message) {
        super(message);
    }

    /**
     * @param message description of the failure
     * @param cause   the underlying exception
     */
    public DatasetPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
