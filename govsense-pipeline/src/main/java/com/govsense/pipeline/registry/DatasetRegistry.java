package com.govsense.pipeline.registry;

import com.govsense.pipeline.exception.DatasetNotFoundException;
import com.govsense.pipeline.model.ColumnSpec;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.MissingValuePolicy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static catalogue of the datasets the pipeline knows, in refresh order.
 */
public class DatasetRegistry {

    private final Map<String, DatasetSpec> specs = new LinkedHashMap<>();

    public DatasetRegistry(List<DatasetSpec> datasets) {
        for (DatasetSpec spec : datasets) {
            validate(spec);
            if (specs.putIfAbsent(spec.getId(), spec) != null) {
                throw new IllegalArgumentException("Duplicate dataset id: " + spec.getId());
            }
        }
    }

    public List<DatasetSpec> listDatasets() {
        return List.copyOf(specs.values());
    }

    public DatasetSpec get(String id) {
        DatasetSpec spec = specs.get(id);
        if (spec == null) {
            throw new DatasetNotFoundException(id);
        }
        return spec;
    }

    public boolean contains(String id) {
        return specs.containsKey(id);
    }

    // Key columns must always be populated, otherwise dedup and upsert are meaningless
    private static void validate(DatasetSpec spec) {
        if (spec.getNaturalKey().isEmpty()) {
            throw new IllegalArgumentException("Dataset " + spec.getId() + " declares no natural key");
        }
        for (String keyColumn : spec.getNaturalKey()) {
            ColumnSpec column = spec.column(keyColumn).orElseThrow(() -> new IllegalArgumentException(
                    "Dataset " + spec.getId() + " key column " + keyColumn + " is not in its schema"));
            if (!column.isRequired() || column.getMissingPolicy() != MissingValuePolicy.REJECT_ROW) {
                throw new IllegalArgumentException(
                        "Dataset " + spec.getId() + " key column " + keyColumn + " must be required and reject missing values");
            }
        }
    }
}
