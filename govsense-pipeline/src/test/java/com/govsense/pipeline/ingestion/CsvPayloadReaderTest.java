package com.govsense.pipeline.ingestion;

import com.govsense.pipeline.exception.SchemaMismatchException;
import com.govsense.pipeline.model.DatasetSpec;
import com.govsense.pipeline.model.RawRecord;
import com.govsense.pipeline.registry.DatasetCatalog;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvPayloadReaderTest {

    private final CsvPayloadReader reader = new CsvPayloadReader();
    private final DatasetSpec communes = DatasetCatalog.communes();

    @Test
    void readsRowsKeyedByHeader() {
        List<RawRecord> rows = read(communes, "code_insee,nom_standard,population\n75056,Paris,2133111\n13055,Marseille,873076\n");

        assertEquals(2, rows.size());
        assertEquals("Paris", rows.get(0).get("nom_standard"));
        assertEquals(1, rows.get(0).getLineNumber());
        assertEquals("873076", rows.get(1).get("population"));
    }

    @Test
    void detectsSeparatorWhenUnset() {
        DatasetSpec unset = communes.toBuilder().separator(null).build();

        List<RawRecord> rows = read(unset, "code_insee;nom_standard;population\n75056;Paris;2133111");

        assertEquals("Paris", rows.get(0).get("nom_standard"));
        assertEquals(';', CsvPayloadReader.detectSeparator("a;b;c,d\n1;2;3"));
        assertEquals(',', CsvPayloadReader.detectSeparator("a,b;c,d"));
    }

    @Test
    void fallsBackToLatin1AndDropsBom() {
        byte[] latin1 = "code_insee,nom_standard\n01004,Ambérieu-en-Bugey".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals("Ambérieu-en-Bugey", readBytes(communes, latin1).get(0).get("nom_standard"));

        byte[] bom = "\uFEFFcode_insee,nom_standard\n01004,Ambérieu-en-Bugey".getBytes(StandardCharsets.UTF_8);
        assertEquals("01004", readBytes(communes, bom).get(0).get("code_insee"));
    }

    @Test
    void padsShortRowsAndSkipsBlankLines() {
        List<RawRecord> rows = read(communes, "code_insee,nom_standard,population\n75056,Paris\n\n13055,Marseille,1\n");

        assertEquals(2, rows.size());
        assertNull(rows.get(0).get("population"));
        assertEquals("13055", rows.get(1).get("code_insee"));
    }

    @Test
    void emptyPayloadIsSchemaMismatch() {
        assertThrows(SchemaMismatchException.class, () -> read(communes, "  \n"));
    }

    @Test
    void headerWithNoKnownColumnIsSchemaMismatch() {
        assertThrows(SchemaMismatchException.class,
                () -> read(communes, "<html><body>Maintenance</body></html>"));
    }

    @Test
    void missingRequiredColumnFailsBeforeAnyRowIsRead() {
        SchemaMismatchException e = assertThrows(SchemaMismatchException.class,
                () -> reader.read(communes, "nom_standard,population\n".getBytes(StandardCharsets.UTF_8)));
        assertTrue(e.getMessage().contains("code_insee"));
    }

    private List<RawRecord> read(DatasetSpec spec, String csv) {
        return readBytes(spec, csv.getBytes(StandardCharsets.UTF_8));
    }

    private List<RawRecord> readBytes(DatasetSpec spec, byte[] payload) {
        try (Stream<RawRecord> rows = reader.read(spec, payload)) {
            return rows.toList();
        }
    }
}
