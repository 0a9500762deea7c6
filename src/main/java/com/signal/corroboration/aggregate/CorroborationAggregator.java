package com.signal.corroboration.aggregate;

import com.signal.corroboration.core.model.EntityRecord;
import com.signal.corroboration.core.model.Observation;
import com.signal.corroboration.metrics.MetricsService;
import com.signal.corroboration.metrics.NoOpMetricsService;
import com.signal.corroboration.rules.ObservationNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds observations into deduplicated, corroboration-ranked entity records.
 *
 * Fold process:
 * 1. Early rejection of excluded raw names
 * 2. Canonical key computation and short-key rejection
 * 3. Lookup-or-create of the record for the key, then field merge
 * 4. Final exclusion check on every canonical key
 * 5. Ranking by (corroboration score, observation count) descending, first-seen key on ties
 *
 * <p>The fold is pure and in-memory; a single aggregator may be reused across folds and
 * from several threads because no state survives a call.</p>
 */
public class CorroborationAggregator {
    private static final Logger log = LoggerFactory.getLogger(CorroborationAggregator.class);

    static final Comparator<EntityRecord> RANKING = Comparator
            .comparingInt(EntityRecord::getCorroborationScore).reversed()
            .thenComparing(Comparator.comparingInt(EntityRecord::getObservationCount).reversed())
            .thenComparingLong(EntityRecord::getFirstSeenOrder);

    private final ObservationNormalizer normalizer;
    private final AggregatorOptions options;
    private final MetricsService metricsService;

    public CorroborationAggregator(ObservationNormalizer normalizer) {
        this(normalizer, AggregatorOptions.defaults(), new NoOpMetricsService());
    }

    public CorroborationAggregator(ObservationNormalizer normalizer,
                                   AggregatorOptions options,
                                   MetricsService metricsService) {
        this.normalizer = normalizer;
        this.options = options;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Consumes every observation and returns the ranked records.
     */
    public ObservationNormalizer getNormalizer() {
        return normalizer;
    }

    public AggregationResult fold(Iterable<Observation> observations) {
        Map<String, EntityAccumulator> byKey = new LinkedHashMap<>();
        int raw = 0;
        int excluded = 0;
        int tooShort = 0;
        int merged = 0;

        for (Observation observation : observations) {
            raw++;
            String name = observation.getEntityName();
            if (normalizer.isExcluded(name)) {
                excluded++;
                continue;
            }

            String key = normalizer.normalize(name);
            if (key.length() < options.getMinKeyLength()) {
                tooShort++;
                log.debug("fold.keyTooShort name='{}' key='{}'", name, key);
                continue;
            }

            EntityAccumulator accumulator = byKey.get(key);
            if (accumulator == null) {
                accumulator = new EntityAccumulator(key, byKey.size(), options);
                byKey.put(key, accumulator);
            } else {
                merged++;
            }
            accumulator.merge(observation);
        }

        List<EntityRecord> records = new ArrayList<>(byKey.size());
        int excludedAfterMerge = 0;
        for (EntityAccumulator accumulator : byKey.values()) {
            if (normalizer.isExcluded(accumulator.getCanonicalKey())) {
                excludedAfterMerge++;
                log.debug("fold.excludedAfterMerge key='{}'", accumulator.getCanonicalKey());
                continue;
            }
            records.add(accumulator.toRecord());
        }
        records.sort(RANKING);

        FoldStatistics statistics = new FoldStatistics(excluded, tooShort, merged, excludedAfterMerge);
        metricsService.recordFold(raw, records.size());
        log.info("fold.completed observations={} entities={} stats={}", raw, records.size(), statistics);
        return new AggregationResult(records, raw, statistics);
    }
}
