package com.govsense.pipeline.cache;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cache key derived from a query type and its request parameters.
 * Parameter order does not matter; null parameter values are dropped.
 */
public record CacheKey(String queryType, Map<String, String> parameters) {

    public CacheKey {
        TreeMap<String, String> sorted = new TreeMap<>();
        if (parameters != null) {
            parameters.forEach((k, v) -> {
                if (v != null) {
                    sorted.put(k, v);
                }
            });
        }
        parameters = Collections.unmodifiableSortedMap(sorted);
    }

    public static CacheKey of(String queryType) {
        return new CacheKey(queryType, Map.of());
    }

    public static CacheKey of(String queryType, Map<String, String> parameters) {
        return new CacheKey(queryType, parameters);
    }
}
