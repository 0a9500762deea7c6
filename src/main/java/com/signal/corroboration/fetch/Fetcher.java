package com.signal.corroboration.fetch;

import java.net.URI;

/**
 * Capability to retrieve a remote document. Source adapters depend on this interface only.
 */
public interface Fetcher {

    /**
     * Retrieves the target. Network-class errors never escape; they are reported as a
     * failed {@link FetchResult}.
     */
    FetchResult fetch(URI target);

    /**
     * Convenience overload for string URLs.
     *
     * @throws IllegalArgumentException if the URL is not a valid URI
     */
    default FetchResult fetch(String url) {
        return fetch(URI.create(url));
    }
}
