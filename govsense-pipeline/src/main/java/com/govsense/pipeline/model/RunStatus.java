package com.govsense.pipeline.model;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED
}
