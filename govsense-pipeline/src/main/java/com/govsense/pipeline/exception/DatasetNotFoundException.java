package com.govsense.pipeline.exception;

public class DatasetNotFoundException extends PipelineException {

    public DatasetNotFoundException(String datasetId) {
        super("Unknown dataset: " + datasetId);
    }
}
