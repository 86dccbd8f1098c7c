package com.govsense.pipeline;

import com.govsense.pipeline.ingestion.CsvPayloadReader;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.RawRecord;

import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

/**
 * Builds raw record streams from inline CSV text, the same way a download would.
 */
public final class TestCsv {

    private static final CsvPayloadReader READER = new CsvPayloadReader();

    private TestCsv() {
    }

    public static Stream<RawRecord> rows(DatasetSpec spec, String... lines) {
        return READER.read(spec, String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }
}
