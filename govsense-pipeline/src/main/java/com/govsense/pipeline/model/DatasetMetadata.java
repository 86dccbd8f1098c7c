package com.govsense.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publisher-side description of a dataset as seen on the last fetch: the
 * data.gouv.fr catalogue entry, or the registry's own description when the
 * source is a direct CSV URL.
 */
@Value
@Builder
public class DatasetMetadata {

    public static final String TABLE = "datasets";

    /** Registry id, the row key */
    String datasetId;

    /** data.gouv.fr dataset id; null for direct URLs */
    String sourceId;

    String title;
    String slug;
    String description;
    String organization;
    String license;

    /** Publisher's last modification, UTC */
    LocalDateTime lastModified;

    /** The CSV actually downloaded */
    String resourceUrl;

    public static DatasetMetadata of(DatasetSpec spec, String resourceUrl) {
        return DatasetMetadata.builder()
                .datasetId(spec.getId())
                .title(spec.getDisplayName())
                .description(spec.getDescription())
                .organization(spec.getPublisher())
                .resourceUrl(resourceUrl)
                .build();
    }

    public Map<String, Object> toRow(LocalDateTime ingestedAt) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", datasetId);
        row.put("source_id", sourceId);
        row.put("title", title);
        row.put("slug", slug);
        row.put("description", description);
        row.put("organization", organization);
        row.put("license", license);
        row.put("last_modified", lastModified);
        row.put("resource_url", resourceUrl);
        row.put("ingested_at", ingestedAt);
        return row;
    }
}
