package com.signal.corroboration.fetch;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Issues a single GET request. Implementations keep session state (cookies) across calls
 * and follow redirects; they do not retry.
 */
public interface HttpTransport {

    /**
     * Performs one GET.
     *
     * @throws IOException          on network-level failure, including timeouts
     * @throws InterruptedException if the calling thread is interrupted
     */
    TransportResponse get(URI uri, Map<String, String> headers, Duration timeout)
            throws IOException, InterruptedException;
}
