package com.signal.corroboration.fetch;

import java.time.Duration;

/**
 * Enforces a minimum interval between consecutive requests of one fetcher.
 * A single clock covers every origin the fetcher talks to.
 */
public class RequestThrottle {

    private final long minIntervalNanos;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private boolean started;
    private long lastRequestNanos;

    public RequestThrottle(Duration minInterval, Ticker ticker, Sleeper sleeper) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    /**
     * Sleeps the remainder of the interval since the previous request, then records
     * the current time as the new last request.
     */
    public synchronized void acquire() throws InterruptedException {
        if (started) {
            long elapsed = ticker.nanos() - lastRequestNanos;
            if (elapsed < minIntervalNanos) {
                sleeper.sleep(Duration.ofNanos(minIntervalNanos - elapsed));
            }
        }
        started = true;
        lastRequestNanos = ticker.nanos();
    }
}
