package com.signal.corroboration.fetch;

import com.signal.corroboration.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResilientFetcher Tests")
class ResilientFetcherTest {

    private static final String TARGET = "https://news.example.com/search?q=erp+rollout";
    private static final String CACHE_PREFIX = "https://webcache.googleusercontent.com/";
    private static final String SEARCH_PREFIX = "https://www.google.com/search";

    private ScriptedHttpTransport transport;
    private ManualClock clock;
    private BlockedOriginRegistry registry;

    @BeforeEach
    void setUp() {
        transport = new ScriptedHttpTransport();
        clock = new ManualClock();
        registry = new BlockedOriginRegistry();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private ResilientFetcher fetcher(FetcherConfig config) {
        return ResilientFetcher.builder()
                .transport(transport)
                .registry(registry)
                .config(config)
                .identityRotator(new IdentityRotator(
                        List.of(new IdentityProfile("TestAgent/1.0", Map.of("Accept", "text/html"))),
                        new Random(1)))
                .sleeper(clock)
                .ticker(clock)
                .build();
    }

    /**
     * Default config without the inter-request interval, so recorded sleeps are backoffs only.
     */
    private ResilientFetcher unthrottled() {
        return fetcher(FetcherConfig.defaults().withMinInterval(Duration.ZERO));
    }

    @Nested
    @DisplayName("Direct retrieval")
    class DirectTests {

        @Test
        @DisplayName("Should return the document on first success without waiting")
        void firstAttemptSucceeds() {
            transport.respond(TARGET, 200, "<html>ok</html>");

            FetchResult result = unthrottled().fetch(TARGET);

            assertTrue(result.isSuccess());
            FetchedDocument doc = result.getDocument().orElseThrow();
            assertEquals(RetrievalStrategy.DIRECT, doc.strategy());
            assertEquals("<html>ok</html>", doc.body());
            assertFalse(doc.isFallback());
            assertEquals(1, transport.getRequests().size());
            assertTrue(clock.getSleeps().isEmpty());
        }

        @Test
        @DisplayName("Should send identity headers and a referer of the target origin")
        void sendsIdentityAndReferer() {
            transport.respond(TARGET, 200, "ok");

            unthrottled().fetch(TARGET);

            Map<String, String> headers = transport.getRequests().get(0).headers();
            assertEquals("TestAgent/1.0", headers.get("User-Agent"));
            assertEquals("text/html", headers.get("Accept"));
            assertEquals("https://news.example.com/", headers.get("Referer"));
        }

        @Test
        @DisplayName("Should retry a server error and succeed on the second attempt")
        void retriesThenSucceeds() {
            transport.statuses(TARGET, 500).respond(TARGET, 200, "second");

            FetchResult result = unthrottled().fetch(TARGET);

            assertEquals("second", result.getDocument().orElseThrow().body());
            assertEquals(List.of(Duration.ofSeconds(2)), clock.getSleeps());
        }

        @Test
        @DisplayName("Should back off 2 then 4 units and give up after the final attempt")
        void exhaustsWithExponentialBackoff() {
            transport.statuses(TARGET, 500);

            FetchResult result = unthrottled().fetch(TARGET);

            assertFalse(result.isSuccess());
            assertEquals(FailureReason.EXHAUSTED, result.getFailureReason().orElseThrow());
            assertEquals(3, transport.getRequests().size());
            assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), clock.getSleeps());
            assertTrue(registry.blockedOrigins().isEmpty());
        }

        @Test
        @DisplayName("Should treat network errors like failed attempts")
        void networkErrorsAreRetried() {
            transport.fail(TARGET, "connection reset");

            FetchResult result = unthrottled().fetch(TARGET);

            assertEquals(FailureReason.EXHAUSTED, result.getFailureReason().orElseThrow());
            assertEquals(3, transport.getRequests().size());
        }

        @Test
        @DisplayName("Should not block the origin on a non-blocking client error")
        void notFoundDoesNotBlock() {
            transport.statuses(TARGET, 404);

            FetchResult result = fetcher(FetcherConfig.defaults().withMinInterval(Duration.ZERO)
                    .withMaxAttempts(2)).fetch(TARGET);

            assertEquals(FailureReason.EXHAUSTED, result.getFailureReason().orElseThrow());
            assertEquals(2, transport.getRequests().size());
            assertFalse(registry.isBlocked("news.example.com"));
        }

        @Test
        @DisplayName("Should wait out the minimum interval between consecutive requests")
        void throttlesConsecutiveRequests() {
            transport.respond("https://news.example.com/", 200, "ok");
            ResilientFetcher fetcher = fetcher(FetcherConfig.defaults());

            fetcher.fetch("https://news.example.com/a");
            fetcher.fetch("https://news.example.com/b");

            assertEquals(List.of(Duration.ofSeconds(2)), clock.getSleeps());
        }
    }

    @Nested
    @DisplayName("Blocking and fallbacks")
    class FallbackTests {

        @Test
        @DisplayName("Should block the origin and report NO_FALLBACK when every fallback fails")
        void accessDeniedWithFailingFallbacks() {
            transport.statuses(TARGET, 403);

            FetchResult result = unthrottled().fetch(TARGET);

            assertEquals(FailureReason.NO_FALLBACK, result.getFailureReason().orElseThrow());
            assertTrue(registry.isBlocked("news.example.com"));
            assertEquals(1, transport.countRequestsTo(TARGET));
            assertEquals(1, transport.countRequestsTo(CACHE_PREFIX));
            assertEquals(1, transport.countRequestsTo(SEARCH_PREFIX));
            assertTrue(clock.getSleeps().isEmpty());
        }

        @Test
        @DisplayName("Should skip direct requests to an origin that is already blocked")
        void blockedOriginIsNeverContactedAgain() {
            transport.statuses(TARGET, 403);
            ResilientFetcher fetcher = unthrottled();
            fetcher.fetch(TARGET);

            FetchResult second = fetcher.fetch("https://news.example.com/other-page");

            assertFalse(second.isSuccess());
            assertEquals(0, transport.countRequestsTo("https://news.example.com/other-page"));
            assertTrue(registry.isBlocked("news.example.com"));
        }

        @Test
        @DisplayName("Should share blocked origins between fetchers using one registry")
        void registryIsShared() {
            transport.statuses(TARGET, 403);
            unthrottled().fetch(TARGET);

            ResilientFetcher other = unthrottled();
            other.fetch("https://news.example.com/archive");

            assertEquals(0, transport.countRequestsTo("https://news.example.com/archive"));
        }

        @Test
        @DisplayName("Should return the cached copy when the cache service has one")
        void cachedCopyWins() {
            transport.statuses(TARGET, 403).respond(CACHE_PREFIX, 200, "cached body");

            FetchResult result = unthrottled().fetch(TARGET);

            FetchedDocument doc = result.getDocument().orElseThrow();
            assertEquals(RetrievalStrategy.CACHED_COPY, doc.strategy());
            assertEquals("cached body", doc.body());
            assertEquals(URI.create(TARGET), doc.requestedUri());
            assertTrue(doc.retrievedUri().toString().startsWith(CACHE_PREFIX));
            assertTrue(doc.isFallback());
            assertEquals(0, transport.countRequestsTo(SEARCH_PREFIX));
        }

        @Test
        @DisplayName("Should fall through to a site search built from the target's query words")
        void siteSearchWins() {
            transport.statuses(TARGET, 403).respond(SEARCH_PREFIX, 200, "results");

            FetchResult result = unthrottled().fetch(TARGET);

            assertEquals(RetrievalStrategy.SITE_SEARCH, result.getDocument().orElseThrow().strategy());
            URI searchUri = transport.getRequests().get(2).uri();
            assertEquals("https://www.google.com/search?q=site:news.example.com+erp+rollout&num=10",
                    searchUri.toString());
        }

        @Test
        @DisplayName("Should treat a non-2xx fallback response as a failed fallback")
        void redirectStatusIsNotAFallbackSuccess() {
            transport.statuses(TARGET, 403).statuses(CACHE_PREFIX, 302).statuses(SEARCH_PREFIX, 429);

            FetchResult result = unthrottled().fetch(TARGET);

            assertEquals(FailureReason.NO_FALLBACK, result.getFailureReason().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Interruption and metrics")
    class InterruptionAndMetricsTests {

        @Test
        @DisplayName("Should stop and restore the interrupt flag when a wait is interrupted")
        void interruptedDuringBackoff() {
            transport.statuses(TARGET, 500);
            ResilientFetcher fetcher = ResilientFetcher.builder()
                    .transport(transport)
                    .registry(registry)
                    .config(FetcherConfig.defaults().withMinInterval(Duration.ZERO))
                    .sleeper(d -> {
                        throw new InterruptedException("stop");
                    })
                    .ticker(clock)
                    .build();

            FetchResult result = fetcher.fetch(TARGET);

            assertEquals(FailureReason.INTERRUPTED, result.getFailureReason().orElseThrow());
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, transport.getRequests().size());
        }

        @Test
        @DisplayName("Should record attempts, retries, blocks and fallback outcomes")
        void recordsMetrics() {
            SimpleMeterRegistry meters = new SimpleMeterRegistry();
            transport.statuses(TARGET, 500, 403).respond(CACHE_PREFIX, 200, "cached");
            ResilientFetcher fetcher = ResilientFetcher.builder()
                    .transport(transport)
                    .registry(registry)
                    .config(FetcherConfig.defaults().withMinInterval(Duration.ZERO))
                    .sleeper(clock)
                    .ticker(clock)
                    .metricsService(new MicrometerMetricsService(meters))
                    .build();

            fetcher.fetch(TARGET);

            assertEquals(2.0, meters.find("fetch.attempts").counter().count());
            assertEquals(1.0, meters.find("fetch.retries").counter().count());
            assertEquals(1.0, meters.find("fetch.origin.blocked").counter().count());
            assertEquals(1.0, meters.find("fetch.fallback")
                    .tag("strategy", "CACHED_COPY").tag("outcome", "success").counter().count());
            assertEquals(1, meters.find("fetch.duration").tag("strategy", "CACHED_COPY").timer().count());
        }
    }
}
