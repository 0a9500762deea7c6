package com.signal.corroboration.fetch;

/**
 * How a document was obtained.
 */
public enum RetrievalStrategy {
    /**
     * Straight from the target origin.
     */
    DIRECT,

    /**
     * From a third-party cached copy of the exact target.
     */
    CACHED_COPY,

    /**
     * From a third-party search scoped to the target origin.
     */
    SITE_SEARCH
}
