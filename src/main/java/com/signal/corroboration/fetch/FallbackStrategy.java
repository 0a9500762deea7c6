package com.signal.corroboration.fetch;

import java.net.URI;

/**
 * Alternate way to obtain a target whose origin refuses direct retrieval.
 */
public interface FallbackStrategy {

    RetrievalStrategy strategy();

    /**
     * The third-party URI to request instead of the target.
     */
    URI fallbackUri(URI target);
}
