package com.signal.corroboration.fetch;

/**
 * Monotonic nanosecond time source, replaceable in tests.
 */
@FunctionalInterface
public interface Ticker {

    long nanos();

    Ticker SYSTEM = System::nanoTime;
}
