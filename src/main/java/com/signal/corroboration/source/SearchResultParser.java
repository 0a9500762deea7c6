package com.signal.corroboration.source;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses result items out of an HTML listing page with CSS selectors.
 *
 * <p>The link is taken from the link selector's {@code href}, resolved against the page URL.
 * When the link selector matches nothing, the closest anchor around the title is used.
 * Items without a title are skipped.</p>
 */
public class SearchResultParser {

    /**
     * Selector set matching the layout of the HTML endpoint of DuckDuckGo.
     */
    public static final Selectors DUCKDUCKGO = new Selectors(
            ".result", ".result__title", ".result__a", ".result__snippet", 10);

    private final Selectors selectors;

    public SearchResultParser(Selectors selectors) {
        this.selectors = Objects.requireNonNull(selectors, "selectors is required");
    }

    public List<SearchHit> parse(String html, String baseUri) {
        List<SearchHit> hits = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return hits;
        }
        Document doc = Jsoup.parse(html, baseUri != null ? baseUri : "");
        for (Element item : doc.select(selectors.item())) {
            if (hits.size() >= selectors.maxItems()) {
                break;
            }
            Element titleEl = item.selectFirst(selectors.title());
            if (titleEl == null || titleEl.text().isBlank()) {
                continue;
            }
            Element snippetEl = selectors.snippet() != null ? item.selectFirst(selectors.snippet()) : null;
            hits.add(new SearchHit(titleEl.text(), linkOf(item, titleEl),
                    snippetEl != null ? snippetEl.text() : ""));
        }
        return hits;
    }

    private String linkOf(Element item, Element titleEl) {
        Element linkEl = selectors.link() != null ? item.selectFirst(selectors.link()) : null;
        if (linkEl == null) {
            linkEl = titleEl.is("a[href]") ? titleEl : titleEl.closest("a[href]");
        }
        if (linkEl == null) {
            linkEl = titleEl.selectFirst("a[href]");
        }
        if (linkEl == null) {
            return "";
        }
        String absolute = linkEl.absUrl("href");
        return absolute.isEmpty() ? linkEl.attr("href") : absolute;
    }

    public Selectors getSelectors() {
        return selectors;
    }

    /**
     * CSS selectors for one page layout.
     *
     * @param item     selects each result container
     * @param title    title element inside an item
     * @param link     anchor inside an item; may be null
     * @param snippet  snippet element inside an item; may be null
     * @param maxItems maximum number of hits returned per page
     */
    public record Selectors(String item, String title, String link, String snippet, int maxItems) {
        public Selectors {
            if (item == null || item.isBlank()) {
                throw new IllegalArgumentException("item selector is required");
            }
            if (title == null || title.isBlank()) {
                throw new IllegalArgumentException("title selector is required");
            }
            if (maxItems < 1) {
                throw new IllegalArgumentException("maxItems must be >= 1");
            }
        }
    }
}
