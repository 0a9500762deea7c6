package com.signal.corroboration.fetch;

import java.net.URI;

/**
 * Raw response returned by an {@link HttpTransport}.
 *
 * @param statusCode HTTP status code
 * @param body       response body
 * @param finalUri   URI of the response after redirects
 */
public record TransportResponse(int statusCode, String body, URI finalUri) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isError() {
        return statusCode >= 400;
    }
}
