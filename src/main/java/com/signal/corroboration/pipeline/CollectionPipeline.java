package com.signal.corroboration.pipeline;

import com.signal.corroboration.aggregate.AggregationResult;
import com.signal.corroboration.aggregate.CorroborationAggregator;
import com.signal.corroboration.core.model.Observation;
import com.signal.corroboration.fetch.BlockedOriginRegistry;
import com.signal.corroboration.inventory.RankedInventory;
import com.signal.corroboration.logging.LogContext;
import com.signal.corroboration.metrics.MetricsService;
import com.signal.corroboration.metrics.NoOpMetricsService;
import com.signal.corroboration.source.SourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the activated sources, isolates their failures, and folds everything they produced
 * into a ranked inventory.
 *
 * <p>Outputs are merged in activation order whatever order the sources finish in, so a
 * parallel run folds to the same inventory as a sequential one.</p>
 */
public class CollectionPipeline {
    private static final Logger log = LoggerFactory.getLogger(CollectionPipeline.class);

    private final SourceRegistry sources;
    private final CorroborationAggregator aggregator;
    private final BlockedOriginRegistry blockedOrigins;
    private final PipelineOptions options;
    private final MetricsService metricsService;

    public CollectionPipeline(SourceRegistry sources, CorroborationAggregator aggregator,
                              BlockedOriginRegistry blockedOrigins) {
        this(sources, aggregator, blockedOrigins, PipelineOptions.sequential(), new NoOpMetricsService());
    }

    public CollectionPipeline(SourceRegistry sources, CorroborationAggregator aggregator,
                              BlockedOriginRegistry blockedOrigins, PipelineOptions options,
                              MetricsService metricsService) {
        this.sources = Objects.requireNonNull(sources, "sources is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.blockedOrigins = Objects.requireNonNull(blockedOrigins, "blockedOrigins is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Runs every registered source.
     */
    public PipelineReport runAll() {
        return run(sources.ids());
    }

    /**
     * Runs the given sources in the given order. Unknown ids are logged and skipped.
     */
    public PipelineReport run(List<String> sourceIds) {
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(runId)) {
            List<String> active = new ArrayList<>();
            List<String> unknown = new ArrayList<>();
            for (String id : sourceIds) {
                if (!sources.contains(id)) {
                    log.warn("pipeline.unknownSource source={}", id);
                    unknown.add(id);
                } else if (!active.contains(id)) {
                    active.add(id);
                }
            }
            log.info("pipeline.started sources={} parallel={}", active, options.parallel());

            List<SourceOutcome> outcomes = options.parallel() && active.size() > 1
                    ? collectConcurrently(active, runId)
                    : collectSequentially(active, runId);

            List<Observation> merged = new ArrayList<>();
            Map<String, Integer> counts = new LinkedHashMap<>();
            Map<String, String> failed = new LinkedHashMap<>();
            for (SourceOutcome outcome : outcomes) {
                if (outcome.error() != null) {
                    failed.put(outcome.sourceId(), outcome.error());
                    metricsService.recordSourceFailed(outcome.sourceId());
                } else {
                    merged.addAll(outcome.observations());
                    counts.put(outcome.sourceId(), outcome.observations().size());
                    metricsService.recordSourceCollected(outcome.sourceId(), outcome.observations().size());
                }
            }

            AggregationResult result = aggregator.fold(merged);
            PipelineReport report = new PipelineReport(
                    runId,
                    new RankedInventory(result, aggregator.getNormalizer()),
                    result.statistics(),
                    counts,
                    failed,
                    unknown,
                    blockedOrigins.blockedOrigins(),
                    Duration.ofNanos(System.nanoTime() - start));
            log.info("pipeline.completed report={}", report);
            return report;
        }
    }

    private List<SourceOutcome> collectSequentially(List<String> active, String runId) {
        List<SourceOutcome> outcomes = new ArrayList<>(active.size());
        for (String id : active) {
            outcomes.add(collectOne(id, runId));
        }
        return outcomes;
    }

    private List<SourceOutcome> collectConcurrently(List<String> active, String runId) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.maxConcurrency(), active.size()));
        try {
            List<CompletableFuture<SourceOutcome>> futures = new ArrayList<>(active.size());
            for (String id : active) {
                CompletableFuture<SourceOutcome> future =
                        CompletableFuture.supplyAsync(() -> collectOne(id, runId), executor);
                if (options.sourceTimeout() != null) {
                    future = future.orTimeout(options.sourceTimeout().toMillis(), TimeUnit.MILLISECONDS);
                }
                futures.add(future);
            }

            List<SourceOutcome> outcomes = new ArrayList<>(active.size());
            for (int i = 0; i < active.size(); i++) {
                String id = active.get(i);
                try {
                    outcomes.add(futures.get(i).join());
                } catch (CompletionException e) {
                    String message = e.getCause() instanceof TimeoutException
                            ? "timed out after " + options.sourceTimeout().toMillis() + "ms"
                            : String.valueOf(e.getCause());
                    log.error("source.failed source={} error={}", id, message);
                    outcomes.add(SourceOutcome.failed(id, message));
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private SourceOutcome collectOne(String id, String runId) {
        Supplier<? extends SourceAdapter> factory = sources.factory(id).orElseThrow();
        try (LogContext ctx = LogContext.forSource(runId, id)) {
            long start = System.nanoTime();
            try {
                SourceAdapter adapter = factory.get();
                List<Observation> observations = adapter.collect();
                List<Observation> safe = observations != null
                        ? observations.stream().filter(Objects::nonNull).toList()
                        : List.<Observation>of();
                log.info("source.completed source={} observations={} durationMs={}",
                        id, safe.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                return new SourceOutcome(id, safe, null);
            } catch (RuntimeException e) {
                log.error("source.failed source={} error={}", id, e.getMessage(), e);
                return SourceOutcome.failed(id, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    private record SourceOutcome(String sourceId, List<Observation> observations, String error) {
        static SourceOutcome failed(String sourceId, String error) {
            return new SourceOutcome(sourceId, List.of(), error);
        }
    }
}
