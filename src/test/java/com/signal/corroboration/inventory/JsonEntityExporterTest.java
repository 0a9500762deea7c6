package com.signal.corroboration.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class JsonEntityExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should write summary counts and ranked entities")
    void testExport() throws IOException {
        StringWriter out = new StringWriter();

        ExportResult result = new JsonEntityExporter().export(InventoryFixtures.sample(), out);

        JsonNode root = mapper.readTree(out.toString());
        assertEquals(8, root.get("rawObservations").asInt());
        assertEquals(4, root.get("totalEntities").asInt());
        assertEquals(2, root.get("highConfidenceEntities").asInt());
        assertTrue(root.get("generatedAt").isTextual());
        assertEquals(1, root.get("regions").get("Unknown").asInt());
        assertEquals(1, root.get("categories").get("Energy").asInt());

        JsonNode first = root.get("entities").get(0);
        assertEquals(1, first.get("rank").asInt());
        assertEquals("acme energy", first.get("key").asText());
        assertEquals(3, first.get("score").asInt());
        assertEquals("reference", first.get("evidence").get(0).asText());
        assertEquals("High", first.get("confidence").asText());
        assertEquals(3, first.get("sources").size());
        assertEquals(new ExportResult("json", 4, 2), result);
    }

    @Test
    @DisplayName("Should omit empty fields from entity entries")
    void testOmitsEmpty() throws IOException {
        StringWriter out = new StringWriter();

        new JsonEntityExporter().export(InventoryFixtures.sample(), out);

        JsonNode harbor = mapper.readTree(out.toString()).get("entities").get(3);
        assertEquals("harbor bank", harbor.get("key").asText());
        assertFalse(harbor.has("region"));
        assertEquals("Banking, Finance", harbor.get("categories").get(0).asText());
    }
}
