package com.govsense.pipeline.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A typed row whose fields follow the canonical column names of its dataset.
 * Values are Long, Double, String or LocalDate; missing values are null.
 */
@Value
public class CleanRecord {

    String datasetId;

    /** Position of the row in the raw input, used for deterministic ordering */
    long sourceIndex;

    Map<String, Object> fields;

    public CleanRecord(String datasetId, long sourceIndex, Map<String, Object> fields) {
        this.datasetId = datasetId;
        this.sourceIndex = sourceIndex;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String column) {
        return fields.get(column);
    }

    public String getString(String column) {
        Object v = fields.get(column);
        return v == null ? null : v.toString();
    }

    public Long getLong(String column) {
        Object v = fields.get(column);
        return v == null ? null : ((Number) v).longValue();
    }

    public Double getDouble(String column) {
        Object v = fields.get(column);
        return v == null ? null : ((Number) v).doubleValue();
    }

    public List<Object> key(List<String> naturalKey) {
        return naturalKey.stream().map(fields::get).toList();
    }
}
