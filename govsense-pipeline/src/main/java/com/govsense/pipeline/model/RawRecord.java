package com.govsense.pipeline.model;

import lombok.Value;

import java.util.Map;

/**
 * One CSV row as fetched, keyed by the source header. Never persisted.
 */
@Value
public class RawRecord {

    /** 1-based line number in the source payload, header excluded */
    long lineNumber;

    /** Header name to untouched text value, in header order */
    Map<String, String> fields;

    public String get(String header) {
        return fields.get(header);
    }
}
