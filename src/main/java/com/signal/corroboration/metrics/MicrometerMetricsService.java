package com.signal.corroboration.metrics;

import com.signal.corroboration.fetch.FailureReason;
import com.signal.corroboration.fetch.RetrievalStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code fetch.attempts}: Counter</li>
 *   <li>{@code fetch.retries}: Counter</li>
 *   <li>{@code fetch.origin.blocked}: Counter</li>
 *   <li>{@code fetch.fallback}: Counter (tags: strategy, outcome)</li>
 *   <li>{@code fetch.duration}: Timer (tag: strategy)</li>
 *   <li>{@code fetch.failures}: Counter (tag: reason)</li>
 *   <li>{@code source.observations}: DistributionSummary (tag: source)</li>
 *   <li>{@code source.failures}: Counter (tag: source)</li>
 *   <li>{@code fold.observations.raw}: DistributionSummary</li>
 *   <li>{@code fold.entities}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter attemptCounter;
    private final Counter retryCounter;
    private final Counter blockedCounter;
    private final DistributionSummary rawObservationSummary;
    private final DistributionSummary entitySummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.attemptCounter = Counter.builder("fetch.attempts")
                .description("Number of direct retrieval attempts")
                .register(registry);
        this.retryCounter = Counter.builder("fetch.retries")
                .description("Number of attempts followed by a backoff and retry")
                .register(registry);
        this.blockedCounter = Counter.builder("fetch.origin.blocked")
                .description("Number of origins newly marked as blocked")
                .register(registry);
        this.rawObservationSummary = DistributionSummary.builder("fold.observations.raw")
                .description("Observations entering a fold")
                .register(registry);
        this.entitySummary = DistributionSummary.builder("fold.entities")
                .description("Entity records produced by a fold")
                .register(registry);
    }

    @Override
    public void recordFetchAttempt() {
        attemptCounter.increment();
    }

    @Override
    public void recordRetry() {
        retryCounter.increment();
    }

    @Override
    public void recordOriginBlocked() {
        blockedCounter.increment();
    }

    @Override
    public void recordFallback(RetrievalStrategy strategy, boolean succeeded) {
        String outcome = succeeded ? "success" : "failure";
        String key = "fallback:" + strategy.name() + ":" + outcome;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("fetch.fallback")
                        .description("Fallback retrievals by strategy and outcome")
                        .tag("strategy", strategy.name())
                        .tag("outcome", outcome)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordFetchSuccess(RetrievalStrategy strategy, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(strategy.name(), k ->
                Timer.builder("fetch.duration")
                        .description("Duration of successful fetches, including retries and waits")
                        .tag("strategy", strategy.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordFetchFailure(FailureReason reason) {
        String key = "failure:" + reason.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("fetch.failures")
                        .description("Fetches that produced no document")
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSourceCollected(String sourceId, int observations) {
        DistributionSummary summary = summaryCache.computeIfAbsent(sourceId, k ->
                DistributionSummary.builder("source.observations")
                        .description("Observations collected per source run")
                        .tag("source", sourceId)
                        .register(registry));
        summary.record(observations);
    }

    @Override
    public void recordSourceFailed(String sourceId) {
        String key = "source-failed:" + sourceId;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("source.failures")
                        .description("Source runs aborted by an exception")
                        .tag("source", sourceId)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordFold(int rawObservations, int entities) {
        rawObservationSummary.record(rawObservations);
        entitySummary.record(entities);
    }
}
