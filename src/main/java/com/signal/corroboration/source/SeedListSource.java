package com.signal.corroboration.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signal.corroboration.core.model.Confidence;
import com.signal.corroboration.core.model.EvidenceKind;
import com.signal.corroboration.core.model.Observation;
import com.signal.corroboration.rules.ExclusionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Curated, locally stored list of known entities. Each entry becomes a
 * {@link EvidenceKind#REFERENCE} observation with {@link Confidence#HIGH} confidence.
 *
 * <p>Expected format:</p>
 * <pre>
 * [
 *   {"name": "Acme Energy LLC", "region": "UAE", "attributes": ["S/4HANA"], "category": "Energy"}
 * ]
 * </pre>
 */
public class SeedListSource implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(SeedListSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<SeedEntry>> ENTRY_LIST = new TypeReference<>() {};

    public static final String DEFAULT_ID = "seed";
    public static final String DEFAULT_LABEL = "Curated Seed List";

    private final String id;
    private final String sourceLabel;
    private final List<SeedEntry> entries;
    private final ExclusionPolicy exclusionPolicy;

    public SeedListSource(List<SeedEntry> entries) {
        this(DEFAULT_ID, DEFAULT_LABEL, entries, ExclusionPolicy.NONE);
    }

    public SeedListSource(String id, String sourceLabel, List<SeedEntry> entries, ExclusionPolicy exclusionPolicy) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.sourceLabel = Objects.requireNonNull(sourceLabel, "sourceLabel is required");
        this.entries = List.copyOf(entries);
        this.exclusionPolicy = Objects.requireNonNull(exclusionPolicy, "exclusionPolicy is required");
    }

    /**
     * Reads a JSON array of seed entries.
     *
     * @throws CatalogLoadException if the stream is not a valid seed list
     */
    public static List<SeedEntry> readEntries(InputStream input) {
        try {
            List<SeedEntry> entries = MAPPER.readValue(input, ENTRY_LIST);
            if (entries == null) {
                throw new CatalogLoadException("Seed list is empty");
            }
            return entries;
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException("Malformed seed list: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot read seed list: " + e.getMessage(), e);
        }
    }

    public static List<SeedEntry> readEntries(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return readEntries(in);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot read seed list " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<Observation> collect() {
        List<Observation> observations = new ArrayList<>();
        int skipped = 0;
        for (SeedEntry entry : entries) {
            if (entry.name() == null || exclusionPolicy.isExcluded(entry.name())) {
                skipped++;
                continue;
            }
            observations.add(Observation.builder()
                    .entityName(entry.name())
                    .region(entry.region())
                    .attributes(entry.attributes())
                    .category(entry.category())
                    .evidenceKind(EvidenceKind.REFERENCE)
                    .confidence(Confidence.HIGH)
                    .sourceLabel(sourceLabel)
                    .referenceUrl(entry.url())
                    .excerpt(entry.category().isEmpty() ? "Known reference" : "Known reference: " + entry.category())
                    .build());
        }
        log.info("source.collected source={} observations={} skipped={}", id, observations.size(), skipped);
        return observations;
    }

    public List<SeedEntry> getEntries() {
        return entries;
    }
}
