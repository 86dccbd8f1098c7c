package com.govsense.pipeline.model;

/**
 * What the cleaner does with a blank or absent value.
 */
public enum MissingValuePolicy {
    REJECT_ROW,
    /** Numeric columns only */
    DEFAULT_TO_ZERO,
    LEAVE_NULL
}
