package com.signal.corroboration.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of one web-search source, as read from a catalog file.
 * Map-valued fields keep their declaration order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("evidenceKind") String evidenceKind,
        @JsonProperty("confidence") String confidence,
        @JsonProperty("category") String category,
        @JsonProperty("targets") List<TargetDefinition> targets,
        @JsonProperty("selectors") SelectorDefinition selectors,
        @JsonProperty("namePatterns") List<String> namePatterns,
        @JsonProperty("nameMinLength") Integer nameMinLength,
        @JsonProperty("nameFallbackLength") Integer nameFallbackLength,
        @JsonProperty("tags") Map<String, String> tags,
        @JsonProperty("fallbackTag") String fallbackTag,
        @JsonProperty("regions") Map<String, List<String>> regions,
        @JsonProperty("requiredTerms") List<String> requiredTerms,
        @JsonProperty("requireRegion") boolean requireRegion,
        @JsonProperty("excerptPrefix") String excerptPrefix
) {
    public SourceDefinition {
        targets = targets != null ? List.copyOf(targets) : List.of();
        namePatterns = namePatterns != null ? List.copyOf(namePatterns) : List.of();
        tags = tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>();
        regions = regions != null ? new LinkedHashMap<>(regions) : new LinkedHashMap<>();
        requiredTerms = requiredTerms != null ? List.copyOf(requiredTerms) : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TargetDefinition(
            @JsonProperty("url") String url,
            @JsonProperty("region") String region
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SelectorDefinition(
            @JsonProperty("item") String item,
            @JsonProperty("title") String title,
            @JsonProperty("link") String link,
            @JsonProperty("snippet") String snippet,
            @JsonProperty("maxItems") Integer maxItems
    ) {}
}
