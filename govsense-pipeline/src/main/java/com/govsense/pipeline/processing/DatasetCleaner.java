package com.govsense.pipeline.processing;

import com.govsense.pipeline.model.CleanRecord;
import com.govsense.pipeline.model.CleaningReport;
import com.govsense.pipeline.model.CleaningResult;
import com.govsense.pipeline.model.ColumnSpec;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.DuplicatePolicy;
import com.govsense.pipeline.model.RawRecord;
import com.govsense.pipeline.model.RejectionReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Turns raw CSV rows into typed, validated, key-unique records.
 *
 * Steps, in order: header mapping to canonical names, type coercion,
 * missing-value policy, deduplication by natural key. Row-level problems
 * never abort the batch; they are counted in the {@link CleaningReport}.
 * The same input always yields the same output.
 */
@Component
@Slf4j
public class DatasetCleaner {

    public CleaningResult clean(DatasetSpec spec, Stream<RawRecord> raw) {
        Map<RejectionReason, Integer> rejections = new EnumMap<>(RejectionReason.class);
        List<CleanRecord> typed = new ArrayList<>();
        Map<String, String> headerFor = null;
        int total = 0;

        Iterator<RawRecord> rows = raw.iterator();
        while (rows.hasNext()) {
            RawRecord row = rows.next();
            if (headerFor == null) {
                headerFor = ColumnNames.mapHeader(spec, row.getFields().keySet());
            }
            total++;

            RowResult result = coerce(spec, headerFor, row);
            if (result.rejection() != null) {
                rejections.merge(result.rejection(), 1, Integer::sum);
                log.debug("Dataset {} line {} rejected: {}", spec.getId(), row.getLineNumber(), result.rejection());
            } else {
                typed.add(new CleanRecord(spec.getId(), row.getLineNumber(), result.fields()));
            }
        }

        List<CleanRecord> kept = spec.getDuplicatePolicy() == DuplicatePolicy.REJECT_ALL
                ? rejectAllDuplicates(spec, typed, rejections)
                : keepLastDuplicates(spec, typed);

        int rejected = rejections.values().stream().mapToInt(Integer::intValue).sum();
        CleaningReport report = CleaningReport.builder()
                .datasetId(spec.getId())
                .totalCount(total)
                .keptCount(kept.size())
                .rejectedCount(rejected)
                .duplicatesRemoved(total - rejected - kept.size())
                .rejectionsByReason(Map.copyOf(rejections))
                .build();

        log.info("Cleaned {}: {} rows in, {} kept, {} rejected {}, {} superseded duplicates",
                spec.getId(), total, kept.size(), rejected, rejections, report.getDuplicatesRemoved());
        return new CleaningResult(List.copyOf(kept), report);
    }

    private RowResult coerce(DatasetSpec spec, Map<String, String> headerFor, RawRecord row) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (ColumnSpec column : spec.getColumns()) {
            String header = headerFor.get(column.getName());
            String text = header == null ? null : row.get(header);

            if (text == null || text.isBlank()) {
                switch (column.getMissingPolicy()) {
                    case REJECT_ROW -> {
                        return RowResult.rejected(RejectionReason.MISSING_REQUIRED);
                    }
                    case DEFAULT_TO_ZERO -> fields.put(column.getName(), FieldParser.zero(column.getType()));
                    case LEAVE_NULL -> fields.put(column.getName(), null);
                }
                continue;
            }

            try {
                fields.put(column.getName(), FieldParser.parse(column.getType(), text));
            } catch (IllegalArgumentException e) {
                if (column.isRequired()) {
                    return RowResult.rejected(RejectionReason.INVALID_VALUE);
                }
                fields.put(column.getName(), null);
            }
        }
        return RowResult.accepted(fields);
    }

    private List<CleanRecord> keepLastDuplicates(DatasetSpec spec, List<CleanRecord> records) {
        Map<List<Object>, Integer> lastIndex = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            lastIndex.put(records.get(i).key(spec.getNaturalKey()), i);
        }
        List<CleanRecord> kept = new ArrayList<>(lastIndex.size());
        for (int i = 0; i < records.size(); i++) {
            if (lastIndex.get(records.get(i).key(spec.getNaturalKey())) == i) {
                kept.add(records.get(i));
            }
        }
        return kept;
    }

    private List<CleanRecord> rejectAllDuplicates(DatasetSpec spec, List<CleanRecord> records,
                                                  Map<RejectionReason, Integer> rejections) {
        Map<List<Object>, Integer> occurrences = new HashMap<>();
        records.forEach(r -> occurrences.merge(r.key(spec.getNaturalKey()), 1, Integer::sum));

        List<CleanRecord> kept = new ArrayList<>(records.size());
        for (CleanRecord record : records) {
            if (occurrences.get(record.key(spec.getNaturalKey())) == 1) {
                kept.add(record);
            } else {
                rejections.merge(RejectionReason.DUPLICATE_KEY, 1, Integer::sum);
            }
        }
        return kept;
    }

    private record RowResult(Map<String, Object> fields, RejectionReason rejection) {

        static RowResult accepted(Map<String, Object> fields) {
            return new RowResult(fields, null);
        }

        static RowResult rejected(RejectionReason reason) {
            return new RowResult(null, reason);
        }
    }
}
