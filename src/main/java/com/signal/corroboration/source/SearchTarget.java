package com.signal.corroboration.source;

import java.net.URI;
import java.util.Objects;

/**
 * A page to fetch plus the region assumed for hits whose text names no region.
 */
public record SearchTarget(URI uri, String defaultRegion) {

    public SearchTarget {
        Objects.requireNonNull(uri, "uri is required");
        defaultRegion = defaultRegion != null ? defaultRegion.trim() : "";
    }

    public static SearchTarget of(String url) {
        return new SearchTarget(URI.create(url), "");
    }

    public static SearchTarget of(String url, String defaultRegion) {
        return new SearchTarget(URI.create(url), defaultRegion);
    }
}
