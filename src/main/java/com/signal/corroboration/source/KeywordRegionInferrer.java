package com.signal.corroboration.source;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Returns the first region, in declaration order, whose keywords appear in the text.
 */
public class KeywordRegionInferrer implements RegionInferrer {

    private final Map<String, List<String>> regionKeywords;

    public KeywordRegionInferrer(Map<String, List<String>> regionKeywords) {
        Map<String, List<String>> lowered = new LinkedHashMap<>();
        regionKeywords.forEach((region, keywords) -> lowered.put(region,
                keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList()));
        this.regionKeywords = lowered;
    }

    @Override
    public String infer(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : regionKeywords.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return "";
    }
}
