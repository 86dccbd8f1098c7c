package com.govsense.pipeline.model;

/**
 * How the cleaner resolves several rows sharing one natural key.
 */
public enum DuplicatePolicy {
    /** Keep the occurrence with the highest input index */
    KEEP_LAST,
    /** Drop every row of a key that occurs more than once */
    REJECT_ALL
}
