package com.govsense.pipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable description of one published dataset: where it comes from, what
 * it looks like and where it lands.
 *
 * The source locator is either a direct http(s) URL to a CSV file or a
 * data.gouv.fr dataset slug that is resolved to its first CSV resource.
 */
@Value
@Builder(toBuilder = true)
public class DatasetSpec {

    String id;
    String displayName;
    String description;
    String publisher;
    String source;

    /** Null means detect from the header line */
    Character separator;

    @Singular
    List<ColumnSpec> columns;

    String targetTable;

    @Singular("naturalKeyColumn")
    List<String> naturalKey;

    @Builder.Default
    DuplicatePolicy duplicatePolicy = DuplicatePolicy.KEEP_LAST;

    /** How often the publisher refreshes the file; informational only */
    Duration refreshCadence;

    public Optional<ColumnSpec> column(String name) {
        return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public boolean isDirectUrl() {
        return source != null && (source.startsWith("http://") || source.startsWith("https://"));
    }
}
