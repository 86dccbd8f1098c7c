package com.govsense.pipeline.exception;

import lombok.Getter;

/**
 * A refresh was requested while another one is still running.
 */
@Getter
public class AlreadyRunningException extends PipelineException {

    private final String runningRunId;

    public AlreadyRunningException(String runningRunId) {
        super("A refresh is already running: " + runningRunId);
        this.runningRunId = runningRunId;
    }
}
