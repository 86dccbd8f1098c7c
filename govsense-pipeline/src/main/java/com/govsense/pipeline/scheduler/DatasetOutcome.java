package com.govsense.pipeline.scheduler;

import com.govsense.pipeline.model.CleaningResult;
import com.govsense.pipeline.model.DatasetMetadata;
import com.govsense.pipeline.model.DatasetSpec;

/**
 * Result of fetching and cleaning one dataset within a run: either the
 * cleaned rows with their catalogue entry, or the reason they are missing.
 */
record DatasetOutcome(DatasetSpec spec, DatasetMetadata metadata, CleaningResult result, String error) {

    static DatasetOutcome succeeded(DatasetSpec spec, DatasetMetadata metadata, CleaningResult result) {
        return new DatasetOutcome(spec, metadata, result, null);
    }

    static DatasetOutcome failed(DatasetSpec spec, String error) {
        return new DatasetOutcome(spec, null, null, error);
    }

    boolean isSuccess() {
        return result != null;
    }
}
