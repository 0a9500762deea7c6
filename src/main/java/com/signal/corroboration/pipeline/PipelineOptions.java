package com.signal.corroboration.pipeline;

import java.time.Duration;

/**
 * Execution settings for a collection run.
 *
 * @param parallel       run adapters concurrently instead of one after another
 * @param maxConcurrency upper bound on adapters running at once when parallel
 * @param sourceTimeout  per-adapter time limit when parallel; null means unlimited
 */
public record PipelineOptions(boolean parallel, int maxConcurrency, Duration sourceTimeout) {

    public PipelineOptions {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        if (sourceTimeout != null && (sourceTimeout.isNegative() || sourceTimeout.isZero())) {
            throw new IllegalArgumentException("sourceTimeout must be positive");
        }
    }

    public static PipelineOptions sequential() {
        return new PipelineOptions(false, 1, null);
    }

    public static PipelineOptions parallel(int maxConcurrency) {
        return new PipelineOptions(true, maxConcurrency, null);
    }

    public PipelineOptions withSourceTimeout(Duration timeout) {
        return new PipelineOptions(parallel, maxConcurrency, timeout);
    }
}
