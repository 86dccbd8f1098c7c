package com.govsense.pipeline.registry;

import com.govsense.pipeline.config.GovSenseProperties;
import com.govsense.pipeline.exception.DatasetNotFoundException;
import com.govsense.pipeline.model.ColumnSpec;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.FieldType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetRegistryTest {

    @Test
    void listsBuiltInDatasetsInRefreshOrder() {
        DatasetRegistry registry = new DatasetRegistry(DatasetCatalog.defaults());

        assertEquals(List.of("region-budgets", "communes", "chomage-regional"),
                registry.listDatasets().stream().map(DatasetSpec::getId).toList());
        assertEquals("region_budgets", registry.get(DatasetCatalog.REGION_BUDGETS).getTargetTable());
        assertTrue(registry.contains(DatasetCatalog.COMMUNES));
    }

    @Test
    void unknownIdIsNotFound() {
        DatasetRegistry registry = new DatasetRegistry(DatasetCatalog.defaults());

        assertFalse(registry.contains("elections"));
        assertThrows(DatasetNotFoundException.class, () -> registry.get("elections"));
    }

    @Test
    void rejectsDuplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> new DatasetRegistry(
                List.of(DatasetCatalog.communes(), DatasetCatalog.communes())));
    }

    @Test
    void keyColumnsMustBeDeclaredAndRequired() {
        DatasetSpec undeclared = DatasetCatalog.communes().toBuilder()
                .clearNaturalKey()
                .naturalKeyColumn("siren")
                .build();
        assertThrows(IllegalArgumentException.class, () -> new DatasetRegistry(List.of(undeclared)));

        DatasetSpec optionalKey = DatasetSpec.builder()
                .id("optional-key")
                .targetTable("optional_key")
                .naturalKeyColumn("code")
                .column(ColumnSpec.builder().name("code").type(FieldType.TEXT).build())
                .build();
        assertThrows(IllegalArgumentException.class, () -> new DatasetRegistry(List.of(optionalKey)));
    }

    @Test
    void configuredSourceOverridesDefault() {
        GovSenseProperties properties = new GovSenseProperties();
        GovSenseProperties.DatasetOverride override = new GovSenseProperties.DatasetOverride();
        override.setSource("https://example.org/communes.csv");
        properties.getDatasets().put(DatasetCatalog.COMMUNES, override);

        DatasetRegistry registry = new DatasetCatalog().datasetRegistry(properties);

        DatasetSpec communes = registry.get(DatasetCatalog.COMMUNES);
        assertEquals("https://example.org/communes.csv", communes.getSource());
        assertTrue(communes.isDirectUrl());
        assertFalse(registry.get(DatasetCatalog.REGION_BUDGETS).isDirectUrl());
    }
}
