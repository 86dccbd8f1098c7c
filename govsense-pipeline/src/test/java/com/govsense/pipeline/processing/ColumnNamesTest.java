package com.govsense.pipeline.processing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ColumnNamesTest {

    @Test
    void normalizesToSnakeCaseAscii() {
        assertEquals("code_region", ColumnNames.normalize("  Code Région "));
        assertEquals("superficie_km2", ColumnNames.normalize("Superficie (km²)"));
        assertEquals("annee", ColumnNames.normalize("\uFEFFAnnée"));
        assertEquals("rec_totales_f", ColumnNames.normalize("REC_TOTALES_F"));
        assertEquals("", ColumnNames.normalize(null));
    }
}
