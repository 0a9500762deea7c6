package com.signal.corroboration.fetch;

/**
 * Why a fetch produced no document.
 */
public enum FailureReason {
    /**
     * Every direct attempt failed with a retryable error.
     */
    EXHAUSTED,

    /**
     * The origin is blocked and every fallback strategy failed.
     */
    NO_FALLBACK,

    /**
     * The calling thread was interrupted while waiting or in flight.
     */
    INTERRUPTED
}
