package com.govsense.pipeline.ingestion;

import com.govsense.pipeline.model.DatasetMetadata;
import com.govsense.pipeline.model.RawRecord;

import java.util.stream.Stream;

/**
 * One download: the lazy row stream plus the catalogue entry it came from.
 * Closing it closes the row stream.
 */
public record FetchedDataset(DatasetMetadata metadata, Stream<RawRecord> rows) implements AutoCloseable {

    @Override
    public void close() {
        rows.close();
    }
}
