package com.govsense.pipeline.exception;

/**
 * Base of every failure the refresh pipeline reports on purpose.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
