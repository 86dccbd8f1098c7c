package com.govsense.pipeline.model;

public enum RejectionReason {
    MISSING_REQUIRED,
    INVALID_VALUE,
    DUPLICATE_KEY
}
