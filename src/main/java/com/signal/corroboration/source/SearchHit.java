package com.signal.corroboration.source;

/**
 * One result item parsed from a listing or search page.
 */
public record SearchHit(String title, String link, String snippet) {

    public SearchHit {
        title = title != null ? title.trim() : "";
        link = link != null ? link.trim() : "";
        snippet = snippet != null ? snippet.trim() : "";
    }

    /**
     * Title and snippet joined by a space.
     */
    public String combinedText() {
        return snippet.isEmpty() ? title : title + " " + snippet;
    }
}
