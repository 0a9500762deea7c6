package com.signal.corroboration.inventory;

import com.signal.corroboration.aggregate.AggregationResult;
import com.signal.corroboration.core.model.EntityRecord;
import com.signal.corroboration.rules.ObservationNormalizer;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Read-only query surface over the ranked entity list produced by a fold.
 * All filters preserve the ranking order.
 */
public class RankedInventory {

    /**
     * Entities corroborated by at least this many distinct evidence kinds count as high confidence.
     */
    public static final int HIGH_CONFIDENCE_SCORE = 2;

    private final List<EntityRecord> entities;
    private final int rawObservationCount;
    private final ObservationNormalizer normalizer;

    public RankedInventory(AggregationResult result) {
        this(result, ObservationNormalizer.createDefault());
    }

    /**
     * @param normalizer the normalizer the result was folded with, used to resolve names in {@link #find}
     */
    public RankedInventory(AggregationResult result, ObservationNormalizer normalizer) {
        Objects.requireNonNull(result, "result is required");
        this.entities = result.entities();
        this.rawObservationCount = result.rawObservationCount();
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    public List<EntityRecord> entities() {
        return entities;
    }

    public int rawObservationCount() {
        return rawObservationCount;
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public List<EntityRecord> byRegion(String region) {
        return filter(e -> e.getRegion().equalsIgnoreCase(region == null ? "" : region.trim()));
    }

    public List<EntityRecord> byCategory(String category) {
        String wanted = category == null ? "" : category.trim();
        return filter(e -> e.getCategories().stream().anyMatch(c -> c.equalsIgnoreCase(wanted)));
    }

    public List<EntityRecord> withMinimumScore(int minimumScore) {
        return filter(e -> e.getCorroborationScore() >= minimumScore);
    }

    public List<EntityRecord> highConfidence() {
        return withMinimumScore(HIGH_CONFIDENCE_SCORE);
    }

    public List<EntityRecord> top(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        return entities.subList(0, Math.min(n, entities.size()));
    }

    /**
     * Looks up an entity by any spelling of its name; the argument is normalized the same way the fold keyed it.
     */
    public Optional<EntityRecord> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = normalizer.normalize(name);
        return entities.stream().filter(e -> e.getCanonicalKey().equals(key)).findFirst();
    }

    /**
     * Entity count per region; entities without a region are counted under "Unknown".
     */
    public Map<String, Long> regionCounts() {
        return countBy(e -> List.of(e.getRegion().isEmpty() ? "Unknown" : e.getRegion()));
    }

    /**
     * Entity count per category; entities without any category are counted under "Unknown".
     */
    public Map<String, Long> categoryCounts() {
        return countBy(e -> e.getCategories().isEmpty() ? List.of("Unknown") : e.getCategories());
    }

    public Map<String, Long> attributeCounts() {
        return countBy(EntityRecord::getAttributes);
    }

    private List<EntityRecord> filter(Predicate<EntityRecord> predicate) {
        return entities.stream().filter(predicate).toList();
    }

    private Map<String, Long> countBy(Function<EntityRecord, Collection<String>> labels) {
        Map<String, Long> counts = new HashMap<>();
        for (EntityRecord entity : entities) {
            for (String label : labels.apply(entity)) {
                counts.merge(label, 1L, Long::sum);
            }
        }
        Map<String, Long> ordered = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEachOrdered(e -> ordered.put(e.getKey(), e.getValue()));
        return ordered;
    }
}
