package com.signal.corroboration.aggregate;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Options for the corroboration fold.
 */
public class AggregatorOptions {

    private static final int DEFAULT_MIN_KEY_LENGTH = 3;
    private static final int DEFAULT_MAX_SOURCES = 5;
    private static final Set<String> DEFAULT_GENERIC_REGIONS = Set.of(
            "gcc", "middle east", "mena", "global", "multi-country", "worldwide");

    private final int minKeyLength;
    private final int maxSources;
    private final Set<String> genericRegions;

    private AggregatorOptions(Builder builder) {
        this.minKeyLength = builder.minKeyLength;
        this.maxSources = builder.maxSources;
        this.genericRegions = Set.copyOf(builder.genericRegions);
    }

    /**
     * Canonical keys shorter than this are dropped as noise.
     */
    public int getMinKeyLength() {
        return minKeyLength;
    }

    /**
     * Maximum number of distinct source labels kept per entity.
     */
    public int getMaxSources() {
        return maxSources;
    }

    /**
     * Lower-cased region labels treated as placeholders that a specific region may replace.
     */
    public Set<String> getGenericRegions() {
        return genericRegions;
    }

    public boolean isGenericRegion(String region) {
        return region != null && genericRegions.contains(region.trim().toLowerCase(Locale.ROOT));
    }

    public static AggregatorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int minKeyLength = DEFAULT_MIN_KEY_LENGTH;
        private int maxSources = DEFAULT_MAX_SOURCES;
        private final Set<String> genericRegions = new LinkedHashSet<>(DEFAULT_GENERIC_REGIONS);

        public Builder minKeyLength(int minKeyLength) {
            if (minKeyLength < 1) {
                throw new IllegalArgumentException("minKeyLength must be >= 1");
            }
            this.minKeyLength = minKeyLength;
            return this;
        }

        public Builder maxSources(int maxSources) {
            if (maxSources < 1) {
                throw new IllegalArgumentException("maxSources must be >= 1");
            }
            this.maxSources = maxSources;
            return this;
        }

        /**
         * Replaces the generic region labels.
         */
        public Builder genericRegions(Set<String> regions) {
            this.genericRegions.clear();
            for (String region : regions) {
                if (region != null && !region.isBlank()) {
                    this.genericRegions.add(region.trim().toLowerCase(Locale.ROOT));
                }
            }
            return this;
        }

        public AggregatorOptions build() {
            return new AggregatorOptions(this);
        }
    }
}
