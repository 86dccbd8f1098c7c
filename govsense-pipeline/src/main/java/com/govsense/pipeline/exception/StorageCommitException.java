package com.govsense.pipeline.exception;

import lombok.Getter;

/**
 * The database rejected a batch. Nothing of that batch is visible.
 */
@Getter
public class StorageCommitException extends PipelineException {

    private final String table;

    public StorageCommitException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }
}
