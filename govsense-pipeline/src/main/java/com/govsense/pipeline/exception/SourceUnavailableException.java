package com.govsense.pipeline.exception;

import lombok.Getter;

/**
 * The remote source could not deliver a dataset.
 *
 * Transient failures (connection errors, timeouts, 5xx, 429) are retried with
 * backoff; permanent ones (404 and other 4xx, no CSV resource) fail at once.
 */
@Getter
public class SourceUnavailableException extends PipelineException {

    private final boolean transientFailure;

    /** HTTP status when the server answered, otherwise null */
    private final Integer httpStatus;

    public SourceUnavailableException(String message, boolean transientFailure, Integer httpStatus) {
        super(message);
        this.transientFailure = transientFailure;
        this.httpStatus = httpStatus;
    }

    public SourceUnavailableException(String message, boolean transientFailure, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.httpStatus = httpStatus;
    }
}
