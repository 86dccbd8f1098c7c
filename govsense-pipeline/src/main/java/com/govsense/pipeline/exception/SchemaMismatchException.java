package com.govsense.pipeline.exception;

/**
 * A fetched payload does not have the columns its dataset declares, or is not
 * readable as CSV at all. Never retried.
 */
public class SchemaMismatchException extends PipelineException {

    public SchemaMismatchException(String message) {
        super(message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
