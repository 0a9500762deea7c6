package com.signal.corroboration.source;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps case-insensitive keywords to tags, e.g. "s4hana" to "SAP S/4HANA".
 */
public class KeywordTagExtractor implements TagExtractor {

    private final Map<String, String> keywordToTag;
    private final String fallbackTag;

    /**
     * @param keywordToTag keyword to tag, scanned in iteration order
     * @param fallbackTag  tag returned when nothing matched, or null for none
     */
    public KeywordTagExtractor(Map<String, String> keywordToTag, String fallbackTag) {
        Map<String, String> lowered = new LinkedHashMap<>();
        keywordToTag.forEach((keyword, tag) -> lowered.put(keyword.toLowerCase(Locale.ROOT), tag));
        this.keywordToTag = lowered;
        this.fallbackTag = fallbackTag;
    }

    /**
     * Extractor that detects each tag by its own name appearing in the text.
     */
    public static KeywordTagExtractor ofTags(Collection<String> tags) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (String tag : tags) {
            mapping.put(tag, tag);
        }
        return new KeywordTagExtractor(mapping, null);
    }

    @Override
    public Set<String> extract(String text) {
        Set<String> tags = new LinkedHashSet<>();
        if (text != null) {
            String lower = text.toLowerCase(Locale.ROOT);
            keywordToTag.forEach((keyword, tag) -> {
                if (lower.contains(keyword)) {
                    tags.add(tag);
                }
            });
        }
        if (tags.isEmpty() && fallbackTag != null) {
            tags.add(fallbackTag);
        }
        return tags;
    }
}
