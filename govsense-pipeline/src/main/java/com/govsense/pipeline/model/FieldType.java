package com.govsense.pipeline.model;

/**
 * Semantic type of a dataset column. Drives coercion in the cleaner and the
 * column type in storage.
 */
public enum FieldType {
    INTEGER,
    DECIMAL,
    TEXT,
    DATE,
    /** Year-month period, normalised to YYYY-MM */
    MONTH,
    /** Administrative code where zero padding is not significant: "011" and "11" are the same region */
    CODE
}
