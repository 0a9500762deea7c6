package com.signal.corroboration.fetch;

import com.signal.corroboration.metrics.MetricsService;
import com.signal.corroboration.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Fetcher} that survives rate limits, access denial and transient failures.
 *
 * Fetch process:
 * 1. Blocked origin: skip direct retrieval and go to the fallback chain
 * 2. Up to {@code maxAttempts} direct attempts, each throttled and sent with a fresh identity
 * 3. Retryable failure (I/O error or non-blocking error status): exponential backoff, retry
 * 4. Blocking status: mark the origin blocked for every fetcher sharing the registry, then fallbacks
 * 5. Fallbacks in order; the first 2xx response wins
 *
 * <p>Each instance owns its throttle clock, identity rotation and transport session. Only the
 * {@link BlockedOriginRegistry} is shared. An instance may be called from several threads, but
 * the intended use is one fetcher per source adapter.</p>
 */
public class ResilientFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(ResilientFetcher.class);

    private final HttpTransport transport;
    private final BlockedOriginRegistry registry;
    private final FetcherConfig config;
    private final IdentityRotator identityRotator;
    private final RequestThrottle throttle;
    private final Sleeper sleeper;
    private final Ticker ticker;
    private final List<FallbackStrategy> fallbacks;
    private final MetricsService metricsService;

    private ResilientFetcher(Builder builder) {
        this.config = builder.config != null ? builder.config : FetcherConfig.defaults();
        this.registry = Objects.requireNonNull(builder.registry, "registry is required");
        this.transport = builder.transport != null
                ? builder.transport
                : new JdkHttpTransport(config.requestTimeout());
        this.identityRotator = builder.identityRotator != null ? builder.identityRotator : new IdentityRotator();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.ticker = builder.ticker != null ? builder.ticker : Ticker.SYSTEM;
        this.throttle = new RequestThrottle(config.minInterval(), ticker, sleeper);
        this.fallbacks = builder.fallbacks != null
                ? List.copyOf(builder.fallbacks)
                : List.of(new CachedCopyFallback(config.cacheServiceTemplate()),
                        new SiteSearchFallback(config.searchServiceTemplate(), config.defaultSearchKeywords()));
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    @Override
    public FetchResult fetch(URI target) {
        Objects.requireNonNull(target, "target is required");
        String origin = Origins.of(target);
        long startNanos = ticker.nanos();

        try {
            if (registry.isBlocked(origin)) {
                log.info("fetch.skipBlocked origin={} target={}", origin, target);
                return fetchViaFallbacks(target, origin, startNanos);
            }

            for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
                metricsService.recordFetchAttempt();
                throttle.acquire();
                try {
                    TransportResponse response = transport.get(target, headersFor(target), config.requestTimeout());
                    if (!response.isError()) {
                        return succeeded(target, response, RetrievalStrategy.DIRECT, startNanos);
                    }
                    if (config.isBlocking(response.statusCode())) {
                        log.warn("fetch.accessDenied status={} origin={} target={}",
                                response.statusCode(), origin, target);
                        if (registry.markBlocked(origin)) {
                            metricsService.recordOriginBlocked();
                        }
                        return fetchViaFallbacks(target, origin, startNanos);
                    }
                    log.warn("fetch.attemptFailed attempt={} target={} status={}",
                            attempt, target, response.statusCode());
                } catch (IOException e) {
                    log.warn("fetch.attemptFailed attempt={} target={} error={}",
                            attempt, target, e.toString());
                }

                if (attempt < config.maxAttempts()) {
                    Duration wait = config.backoffAfter(attempt);
                    metricsService.recordRetry();
                    log.debug("fetch.backoff attempt={} wait={}ms target={}", attempt, wait.toMillis(), target);
                    sleeper.sleep(wait);
                }
            }

            log.error("fetch.exhausted attempts={} target={}", config.maxAttempts(), target);
            metricsService.recordFetchFailure(FailureReason.EXHAUSTED);
            return FetchResult.failure(target, FailureReason.EXHAUSTED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("fetch.interrupted target={}", target);
            metricsService.recordFetchFailure(FailureReason.INTERRUPTED);
            return FetchResult.failure(target, FailureReason.INTERRUPTED);
        }
    }

    private FetchResult fetchViaFallbacks(URI target, String origin, long startNanos) throws InterruptedException {
        for (FallbackStrategy fallback : fallbacks) {
            URI fallbackUri = fallback.fallbackUri(target);
            throttle.acquire();
            try {
                TransportResponse response = transport.get(fallbackUri, headersFor(fallbackUri), config.requestTimeout());
                if (response.isSuccessful()) {
                    metricsService.recordFallback(fallback.strategy(), true);
                    log.info("fetch.fallbackSucceeded strategy={} origin={} target={}",
                            fallback.strategy(), origin, target);
                    return succeeded(target, response, fallback.strategy(), startNanos);
                }
                log.debug("fetch.fallbackFailed strategy={} status={} target={}",
                        fallback.strategy(), response.statusCode(), target);
            } catch (IOException e) {
                log.debug("fetch.fallbackFailed strategy={} target={} error={}",
                        fallback.strategy(), target, e.toString());
            }
            metricsService.recordFallback(fallback.strategy(), false);
        }

        log.warn("fetch.noFallback origin={} target={}", origin, target);
        metricsService.recordFetchFailure(FailureReason.NO_FALLBACK);
        return FetchResult.failure(target, FailureReason.NO_FALLBACK);
    }

    private FetchResult succeeded(URI target, TransportResponse response, RetrievalStrategy strategy, long startNanos) {
        URI retrieved = response.finalUri() != null ? response.finalUri() : target;
        metricsService.recordFetchSuccess(strategy, Duration.ofNanos(ticker.nanos() - startNanos));
        log.debug("fetch.succeeded strategy={} status={} target={}", strategy, response.statusCode(), target);
        return FetchResult.success(new FetchedDocument(target, retrieved, response.statusCode(),
                response.body(), strategy));
    }

    private Map<String, String> headersFor(URI uri) {
        IdentityProfile identity = identityRotator.next();
        Map<String, String> headers = new LinkedHashMap<>(identity.headers());
        headers.put("User-Agent", identity.userAgent());
        headers.put("Referer", Origins.referer(uri));
        return headers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private HttpTransport transport;
        private BlockedOriginRegistry registry;
        private FetcherConfig config;
        private IdentityRotator identityRotator;
        private Sleeper sleeper;
        private Ticker ticker;
        private List<FallbackStrategy> fallbacks;
        private MetricsService metricsService;

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * The registry shared by every fetcher of a run. Required.
         */
        public Builder registry(BlockedOriginRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder config(FetcherConfig config) {
            this.config = config;
            return this;
        }

        public Builder identityRotator(IdentityRotator identityRotator) {
            this.identityRotator = identityRotator;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        /**
         * Replaces the default cached-copy then site-search chain.
         */
        public Builder fallbacks(List<FallbackStrategy> fallbacks) {
            this.fallbacks = fallbacks;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public ResilientFetcher build() {
            return new ResilientFetcher(this);
        }
    }
}
