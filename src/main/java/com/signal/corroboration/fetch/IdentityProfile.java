package com.signal.corroboration.fetch;

import java.util.Map;
import java.util.Objects;

/**
 * An outbound client identity: a user agent plus the browser headers that go with it.
 */
public record IdentityProfile(String userAgent, Map<String, String> headers) {

    public IdentityProfile {
        Objects.requireNonNull(userAgent, "userAgent is required");
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }
}
