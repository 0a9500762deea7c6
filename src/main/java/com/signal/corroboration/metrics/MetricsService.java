package com.signal.corroboration.metrics;

import com.signal.corroboration.fetch.FailureReason;
import com.signal.corroboration.fetch.RetrievalStrategy;

import java.time.Duration;

/**
 * Interface for recording retrieval and aggregation metrics.
 * The default {@link NoOpMetricsService} does nothing, so callers never need a registry.
 */
public interface MetricsService {

    void recordFetchAttempt();

    void recordRetry();

    void recordOriginBlocked();

    void recordFallback(RetrievalStrategy strategy, boolean succeeded);

    void recordFetchSuccess(RetrievalStrategy strategy, Duration duration);

    void recordFetchFailure(FailureReason reason);

    void recordSourceCollected(String sourceId, int observations);

    void recordSourceFailed(String sourceId);

    void recordFold(int rawObservations, int entities);
}
