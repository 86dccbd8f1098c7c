package com.govsense.pipeline.ingestion;

import com.govsense.pipeline.exception.SchemaMismatchException;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.RawRecord;
import com.govsense.pipeline.processing.ColumnNames;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Decodes a downloaded CSV payload into a lazy, one-shot stream of raw rows.
 *
 * The header is read eagerly so that an unreadable payload, or one that lacks
 * a required column of its dataset, fails before any row is handed out. Rows are
 * parsed as the stream is consumed; short rows are padded with nulls and left
 * for the cleaner to judge.
 */
@Component
@Slf4j
public class CsvPayloadReader {

    public Stream<RawRecord> read(DatasetSpec spec, byte[] payload) {
        String text = decode(payload);
        if (text.isBlank()) {
            throw new SchemaMismatchException("Dataset " + spec.getId() + ": empty payload");
        }

        char separator = spec.getSeparator() != null ? spec.getSeparator() : detectSeparator(text);
        CSVReader reader = new CSVReaderBuilder(new StringReader(text))
                .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
                .build();

        String[] header = readHeader(spec, reader);
        requireKnownColumns(spec, header);
        ColumnNames.mapHeader(spec, Arrays.asList(header));
        log.debug("Dataset {}: header {} (separator '{}')", spec.getId(), Arrays.toString(header), separator);

        return StreamSupport.stream(new RowSpliterator(spec.getId(), reader, header), false)
                .onClose(() -> closeReader(reader));
    }

    /**
     * ';' when the header line has more semicolons than commas, ',' otherwise.
     */
    static char detectSeparator(String text) {
        int end = text.indexOf('\n');
        String firstLine = end < 0 ? text : text.substring(0, end);
        long semicolons = firstLine.chars().filter(c -> c == ';').count();
        long commas = firstLine.chars().filter(c -> c == ',').count();
        return semicolons > commas ? ';' : ',';
    }

    /**
     * UTF-8 when the bytes are valid UTF-8, ISO-8859-1 otherwise. A leading BOM is dropped.
     */
    static String decode(byte[] payload) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("Payload is not valid UTF-8, decoding as ISO-8859-1");
            text = new String(payload, StandardCharsets.ISO_8859_1);
        }
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private String[] readHeader(DatasetSpec spec, CSVReader reader) {
        try {
            String[] header = reader.readNext();
            if (header == null || header.length == 0) {
                throw new SchemaMismatchException("Dataset " + spec.getId() + ": no header row");
            }
            return Arrays.stream(header).map(h -> h == null ? "" : h.trim()).toArray(String[]::new);
        } catch (IOException | CsvValidationException e) {
            throw new SchemaMismatchException("Dataset " + spec.getId() + ": unreadable header", e);
        }
    }

    // A header sharing nothing with the dataset is usually an HTML error page, reported as such
    private void requireKnownColumns(DatasetSpec spec, String[] header) {
        Set<String> accepted = spec.getColumns().stream()
                .flatMap(c -> ColumnNames.acceptedNames(c).stream())
                .collect(Collectors.toSet());
        boolean anyKnown = Arrays.stream(header).map(ColumnNames::normalize).anyMatch(accepted::contains);
        if (!anyKnown) {
            throw new SchemaMismatchException("Dataset " + spec.getId()
                    + ": none of the expected columns found in header " + Arrays.toString(header));
        }
    }

    private static void closeReader(CSVReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static final class RowSpliterator extends Spliterators.AbstractSpliterator<RawRecord> {

        private final String datasetId;
        private final CSVReader reader;
        private final String[] header;
        private long lineNumber;

        RowSpliterator(String datasetId, CSVReader reader, String[] header) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.datasetId = datasetId;
            this.reader = reader;
            this.header = header;
        }

        @Override
        public boolean tryAdvance(Consumer<? super RawRecord> action) {
            try {
                String[] cols;
                do {
                    cols = reader.readNext();
                    if (cols == null) return false;
                    lineNumber++;
                } while (isBlank(cols));

                Map<String, String> fields = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    fields.putIfAbsent(header[i], i < cols.length ? cols[i] : null);
                }
                action.accept(new RawRecord(lineNumber, fields));
                return true;
            } catch (IOException | CsvValidationException e) {
                throw new SchemaMismatchException("Dataset " + datasetId + ": malformed CSV after line " + lineNumber, e);
            }
        }

        private static boolean isBlank(String[] cols) {
            return cols.length == 1 && (cols[0] == null || cols[0].isBlank());
        }
    }
}
