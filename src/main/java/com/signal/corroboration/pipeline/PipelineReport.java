package com.signal.corroboration.pipeline;

import com.signal.corroboration.aggregate.FoldStatistics;
import com.signal.corroboration.inventory.RankedInventory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one collection run. The inventory is always present, possibly empty.
 *
 * @param runId                identifier used in the run's log context
 * @param inventory            ranked entities
 * @param foldStatistics       counters from the fold
 * @param observationsBySource observations contributed per source that completed, in activation order
 * @param failedSources        source id to failure message for sources that threw or timed out
 * @param unknownSources       requested ids with no registered source
 * @param blockedOrigins       origins blocked at the end of the run
 * @param elapsed              wall-clock duration of the run
 */
public record PipelineReport(
        String runId,
        RankedInventory inventory,
        FoldStatistics foldStatistics,
        Map<String, Integer> observationsBySource,
        Map<String, String> failedSources,
        List<String> unknownSources,
        Set<String> blockedOrigins,
        Duration elapsed
) {
    public PipelineReport {
        observationsBySource = Collections.unmodifiableMap(new LinkedHashMap<>(observationsBySource));
        failedSources = Collections.unmodifiableMap(new LinkedHashMap<>(failedSources));
        unknownSources = List.copyOf(unknownSources);
        blockedOrigins = Collections.unmodifiableSet(new LinkedHashSet<>(blockedOrigins));
    }

    public boolean hasFailures() {
        return !failedSources.isEmpty();
    }

    public int totalObservations() {
        return observationsBySource.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return "PipelineReport{runId=" + runId +
                ", entities=" + inventory.size() +
                ", observations=" + totalObservations() +
                ", failed=" + failedSources.keySet() +
                ", blockedOrigins=" + blockedOrigins.size() +
                ", elapsedMs=" + elapsed.toMillis() + '}';
    }
}
