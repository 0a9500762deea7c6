package com.signal.corroboration.inventory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signal.corroboration.core.model.EntityRecord;
import com.signal.corroboration.core.model.EvidenceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON exporter writing a single document with summary breakdowns and the ranked entities.
 */
public class JsonEntityExporter implements EntityExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonEntityExporter.class);

    private final ObjectMapper mapper;

    public JsonEntityExporter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ExportResult export(RankedInventory inventory, OutputStream output) throws IOException {
        return export(inventory, new OutputStreamWriter(output, StandardCharsets.UTF_8));
    }

    @Override
    public ExportResult export(RankedInventory inventory, Writer writer) throws IOException {
        List<EntityRecord> entities = inventory.entities();
        List<EntityView> views = new ArrayList<>(entities.size());
        for (int i = 0; i < entities.size(); i++) {
            views.add(EntityView.of(i + 1, entities.get(i)));
        }
        Document document = new Document(
                Instant.now(),
                inventory.rawObservationCount(),
                entities.size(),
                inventory.highConfidence().size(),
                inventory.regionCounts(),
                inventory.categoryCounts(),
                inventory.attributeCounts(),
                views);

        mapper.writeValue(writer, document);
        writer.flush();

        ExportResult result = new ExportResult(getFormat(), document.totalEntities(), document.highConfidenceEntities());
        log.info("export.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private static String confidenceLabel(EntityRecord entity) {
        return entity.getBestConfidence() != null ? entity.getBestConfidence().getLabel() : "";
    }

    public record Document(
            Instant generatedAt,
            int rawObservations,
            long totalEntities,
            long highConfidenceEntities,
            Map<String, Long> regions,
            Map<String, Long> categories,
            Map<String, Long> attributes,
            List<EntityView> entities
    ) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record EntityView(
            int rank,
            String name,
            String key,
            String region,
            int score,
            List<String> evidence,
            List<String> attributes,
            List<String> categories,
            List<String> sources,
            int observations,
            String confidence
    ) {
        static EntityView of(int rank, EntityRecord entity) {
            return new EntityView(
                    rank,
                    entity.getDisplayName(),
                    entity.getCanonicalKey(),
                    entity.getRegion(),
                    entity.getCorroborationScore(),
                    entity.getEvidenceKinds().stream().map(EvidenceKind::getLabel).toList(),
                    List.copyOf(entity.getAttributes()),
                    List.copyOf(entity.getCategories()),
                    entity.getSources(),
                    entity.getObservationCount(),
                    confidenceLabel(entity));
        }
    }
}
