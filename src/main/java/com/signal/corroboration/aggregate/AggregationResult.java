package com.signal.corroboration.aggregate;

import com.signal.corroboration.core.model.EntityRecord;

import java.util.List;

/**
 * Outcome of a fold: the ranked entity records plus the pre-deduplication observation count.
 */
public record AggregationResult(
        List<EntityRecord> entities,
        int rawObservationCount,
        FoldStatistics statistics
) {
    public AggregationResult {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public static AggregationResult empty() {
        return new AggregationResult(List.of(), 0, new FoldStatistics(0, 0, 0, 0));
    }
}
