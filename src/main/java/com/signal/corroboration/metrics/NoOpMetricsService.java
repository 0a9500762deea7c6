package com.signal.corroboration.metrics;

import com.signal.corroboration.fetch.FailureReason;
import com.signal.corroboration.fetch.RetrievalStrategy;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordFetchAttempt() {
    }

    @Override
    public void recordRetry() {
    }

    @Override
    public void recordOriginBlocked() {
    }

    @Override
    public void recordFallback(RetrievalStrategy strategy, boolean succeeded) {
    }

    @Override
    public void recordFetchSuccess(RetrievalStrategy strategy, Duration duration) {
    }

    @Override
    public void recordFetchFailure(FailureReason reason) {
    }

    @Override
    public void recordSourceCollected(String sourceId, int observations) {
    }

    @Override
    public void recordSourceFailed(String sourceId) {
    }

    @Override
    public void recordFold(int rawObservations, int entities) {
    }
}
