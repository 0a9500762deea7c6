package com.signal.corroboration.fetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fake time: a {@link Ticker} that only moves when slept on, and a {@link Sleeper} that
 * records every wait instead of blocking.
 */
public class ManualClock implements Ticker, Sleeper {

    private long nanos;
    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public synchronized long nanos() {
        return nanos;
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        nanos += duration.toNanos();
    }

    public synchronized void advance(Duration duration) {
        nanos += duration.toNanos();
    }

    public synchronized List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
