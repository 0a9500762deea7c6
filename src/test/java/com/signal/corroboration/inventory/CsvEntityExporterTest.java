package com.signal.corroboration.inventory;

import com.signal.corroboration.aggregate.AggregationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CsvEntityExporterTest {

    private final CsvEntityExporter exporter = new CsvEntityExporter();

    @Test
    @DisplayName("Should write a header and one row per entity in rank order")
    void testExport() throws IOException {
        StringWriter out = new StringWriter();

        ExportResult result = exporter.export(InventoryFixtures.sample(), out);

        String[] lines = out.toString().split("\\R");
        assertEquals(5, lines.length);
        assertEquals(CsvEntityExporter.HEADER, lines[0]);
        assertEquals("1,Acme Energy Group,acme energy,UAE,3,reference; announcement; case-study,"
                + "SAP BTP; SAP S/4HANA,Energy,Seed; Press; Stories,3,High", lines[1]);
        assertTrue(lines[2].startsWith("2,Qatar Steel,qatar steel,Qatar,2,reference; hiring-signal,"));
        assertEquals("4,Harbor Bank,harbor bank,,1,announcement,SAP SuccessFactors,\"Banking, Finance\",Press,1,Medium",
                lines[4]);
        assertEquals(new ExportResult("csv", 4, 2), result);
    }

    @Test
    @DisplayName("Should write only the header for an empty inventory")
    void testEmpty() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        ExportResult result = exporter.export(new RankedInventory(AggregationResult.empty()), out);

        assertEquals(CsvEntityExporter.HEADER, out.toString(StandardCharsets.UTF_8).trim());
        assertEquals(0, result.totalEntities());
    }

    @ParameterizedTest
    @DisplayName("Should quote values containing separators or quotes")
    @CsvSource(delimiter = '|', value = {
            "plain|plain",
            "a,b|\"a,b\"",
            "say \"hi\"|\"say \"\"hi\"\"\""
    })
    void testCsvEscape(String value, String expected) {
        assertEquals(expected, CsvEntityExporter.csvEscape(value));
    }

    @Test
    @DisplayName("Should surface write failures as IOException")
    void testWriteFailure() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void close() {
            }
        };

        assertThrows(IOException.class, () -> exporter.export(InventoryFixtures.sample(), broken));
    }
}
