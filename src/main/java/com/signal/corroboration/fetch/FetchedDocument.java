package com.signal.corroboration.fetch;

import java.net.URI;
import java.util.Objects;

/**
 * A successfully retrieved document.
 *
 * @param requestedUri the target the caller asked for
 * @param retrievedUri the URI actually fetched (differs from the target for fallbacks)
 * @param statusCode   HTTP status of the final response
 * @param body         response body as text
 * @param strategy     how the document was obtained
 */
public record FetchedDocument(
        URI requestedUri,
        URI retrievedUri,
        int statusCode,
        String body,
        RetrievalStrategy strategy
) {
    public FetchedDocument {
        Objects.requireNonNull(requestedUri, "requestedUri is required");
        Objects.requireNonNull(retrievedUri, "retrievedUri is required");
        Objects.requireNonNull(strategy, "strategy is required");
        body = body != null ? body : "";
    }

    public boolean isFallback() {
        return strategy != RetrievalStrategy.DIRECT;
    }
}
