package com.signal.corroboration.fetch;

import java.net.URI;
import java.util.Locale;

/**
 * Origin helpers. An origin is the lower-cased host plus an explicit port when present.
 */
public final class Origins {

    private Origins() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException if the URI has no host
     */
    public static String of(URI uri) {
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("URI has no host: " + uri);
        }
        String origin = host.toLowerCase(Locale.ROOT);
        return uri.getPort() >= 0 ? origin + ":" + uri.getPort() : origin;
    }

    /**
     * Referer value pointing at the root of the URI's own origin.
     */
    public static String referer(URI uri) {
        String scheme = uri.getScheme() != null ? uri.getScheme() : "https";
        return scheme + "://" + of(uri) + "/";
    }
}
