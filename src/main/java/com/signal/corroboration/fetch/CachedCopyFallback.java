package com.signal.corroboration.fetch;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Requests a cached copy of the exact target from a cache service.
 */
public class CachedCopyFallback implements FallbackStrategy {

    private final String template;

    /**
     * @param template service URL containing {@code {url}}
     */
    public CachedCopyFallback(String template) {
        if (template == null || !template.contains("{url}")) {
            throw new IllegalArgumentException("template must contain {url}");
        }
        this.template = template;
    }

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.CACHED_COPY;
    }

    @Override
    public URI fallbackUri(URI target) {
        String encoded = URLEncoder.encode(target.toString(), StandardCharsets.UTF_8);
        return URI.create(template.replace("{url}", encoded));
    }
}
