package com.signal.corroboration.fetch;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Searches the target's origin for keywords taken from the target's own query, or from its
 * path when it has no query.
 */
public class SiteSearchFallback implements FallbackStrategy {

    static final int MAX_KEYWORDS = 5;
    private static final Pattern KEYWORD = Pattern.compile("[a-zA-Z]{3,}");

    private final String template;
    private final List<String> defaultKeywords;

    /**
     * @param template        service URL containing {@code {origin}} and {@code {keywords}}
     * @param defaultKeywords used when the target yields no keyword
     */
    public SiteSearchFallback(String template, List<String> defaultKeywords) {
        if (template == null || !template.contains("{origin}") || !template.contains("{keywords}")) {
            throw new IllegalArgumentException("template must contain {origin} and {keywords}");
        }
        this.template = template;
        this.defaultKeywords = defaultKeywords != null ? List.copyOf(defaultKeywords) : List.of();
    }

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.SITE_SEARCH;
    }

    @Override
    public URI fallbackUri(URI target) {
        List<String> keywords = extractKeywords(target);
        if (keywords.isEmpty()) {
            keywords = defaultKeywords;
        }
        String encoded = URLEncoder.encode(String.join(" ", keywords), StandardCharsets.UTF_8);
        String origin = URLEncoder.encode(Origins.of(target), StandardCharsets.UTF_8);
        return URI.create(template.replace("{origin}", origin).replace("{keywords}", encoded));
    }

    /**
     * Up to five alphabetic words of three or more letters from the decoded query,
     * falling back to the decoded path.
     */
    public static List<String> extractKeywords(URI target) {
        String source = target.getQuery();
        if (source == null || source.isBlank()) {
            source = target.getPath();
        }
        List<String> keywords = new ArrayList<>();
        if (source == null) {
            return keywords;
        }
        Matcher matcher = KEYWORD.matcher(source);
        while (matcher.find() && keywords.size() < MAX_KEYWORDS) {
            keywords.add(matcher.group());
        }
        return keywords;
    }
}
