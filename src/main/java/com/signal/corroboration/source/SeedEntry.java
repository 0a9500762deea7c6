package com.signal.corroboration.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One curated entry of a seed list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeedEntry(
        @JsonProperty("name") String name,
        @JsonProperty("region") String region,
        @JsonProperty("attributes") List<String> attributes,
        @JsonProperty("category") String category,
        @JsonProperty("url") String url
) {
    public SeedEntry {
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
        region = region != null ? region : "";
        category = category != null ? category : "";
        url = url != null ? url : "";
    }
}
