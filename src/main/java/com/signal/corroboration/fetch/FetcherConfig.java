package com.signal.corroboration.fetch;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Configuration for a {@link ResilientFetcher}.
 *
 * @param minInterval           minimum time between two requests of one fetcher
 * @param maxAttempts           direct attempts per target before giving up
 * @param backoffUnit           base wait; the wait after attempt n is {@code backoffUnit * 2^n}
 * @param requestTimeout        timeout of a single request
 * @param blockingStatusCodes   statuses that block the origin instead of being retried
 * @param cacheServiceTemplate  cached-copy service URL, {@code {url}} replaced by the encoded target
 * @param searchServiceTemplate search service URL, {@code {origin}} and {@code {keywords}} replaced
 * @param defaultSearchKeywords keywords used when none can be extracted from the target
 */
public record FetcherConfig(
        Duration minInterval,
        int maxAttempts,
        Duration backoffUnit,
        Duration requestTimeout,
        Set<Integer> blockingStatusCodes,
        String cacheServiceTemplate,
        String searchServiceTemplate,
        List<String> defaultSearchKeywords
) {

    public static final String DEFAULT_CACHE_TEMPLATE =
            "https://webcache.googleusercontent.com/search?q=cache:{url}";
    public static final String DEFAULT_SEARCH_TEMPLATE =
            "https://www.google.com/search?q=site:{origin}+{keywords}&num=10";

    public FetcherConfig {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be >= 0");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffUnit == null || backoffUnit.isNegative()) {
            throw new IllegalArgumentException("backoffUnit must be >= 0");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
        if (cacheServiceTemplate == null || !cacheServiceTemplate.contains("{url}")) {
            throw new IllegalArgumentException("cacheServiceTemplate must contain {url}");
        }
        if (searchServiceTemplate == null || !searchServiceTemplate.contains("{origin}")
                || !searchServiceTemplate.contains("{keywords}")) {
            throw new IllegalArgumentException("searchServiceTemplate must contain {origin} and {keywords}");
        }
        blockingStatusCodes = blockingStatusCodes != null ? Set.copyOf(blockingStatusCodes) : Set.of(403);
        defaultSearchKeywords = defaultSearchKeywords != null ? List.copyOf(defaultSearchKeywords) : List.of();
    }

    /**
     * Defaults: 2s interval, 3 attempts, 1s backoff unit, 20s timeout, 403 blocks the origin.
     */
    public static FetcherConfig defaults() {
        return new FetcherConfig(
                Duration.ofSeconds(2),
                3,
                Duration.ofSeconds(1),
                Duration.ofSeconds(20),
                Set.of(403),
                DEFAULT_CACHE_TEMPLATE,
                DEFAULT_SEARCH_TEMPLATE,
                List.of());
    }

    public FetcherConfig withMinInterval(Duration value) {
        return new FetcherConfig(value, maxAttempts, backoffUnit, requestTimeout, blockingStatusCodes,
                cacheServiceTemplate, searchServiceTemplate, defaultSearchKeywords);
    }

    public FetcherConfig withMaxAttempts(int value) {
        return new FetcherConfig(minInterval, value, backoffUnit, requestTimeout, blockingStatusCodes,
                cacheServiceTemplate, searchServiceTemplate, defaultSearchKeywords);
    }

    public FetcherConfig withBackoffUnit(Duration value) {
        return new FetcherConfig(minInterval, maxAttempts, value, requestTimeout, blockingStatusCodes,
                cacheServiceTemplate, searchServiceTemplate, defaultSearchKeywords);
    }

    public FetcherConfig withRequestTimeout(Duration value) {
        return new FetcherConfig(minInterval, maxAttempts, backoffUnit, value, blockingStatusCodes,
                cacheServiceTemplate, searchServiceTemplate, defaultSearchKeywords);
    }

    public FetcherConfig withDefaultSearchKeywords(List<String> value) {
        return new FetcherConfig(minInterval, maxAttempts, backoffUnit, requestTimeout, blockingStatusCodes,
                cacheServiceTemplate, searchServiceTemplate, value);
    }

    public boolean isBlocking(int statusCode) {
        return blockingStatusCodes.contains(statusCode);
    }

    /**
     * Wait after the given 1-based attempt.
     */
    public Duration backoffAfter(int attempt) {
        return backoffUnit.multipliedBy(1L << attempt);
    }
}
