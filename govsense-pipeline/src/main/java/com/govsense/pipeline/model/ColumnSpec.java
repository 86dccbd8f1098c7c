package com.govsense.pipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One canonical column of a dataset.
 *
 * The canonical name doubles as the storage column name. Aliases list the
 * header spellings seen in the published CSVs; matching ignores case,
 * accents, whitespace and punctuation.
 */
@Value
@Builder
public class ColumnSpec {

    String name;
    FieldType type;

    /** Required columns must be present in the header; a bad value drops the row */
    boolean required;

    @Builder.Default
    MissingValuePolicy missingPolicy = MissingValuePolicy.LEAVE_NULL;

    @Singular("alias")
    List<String> aliases;
}
