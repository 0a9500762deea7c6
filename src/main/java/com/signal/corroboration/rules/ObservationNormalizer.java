package com.signal.corroboration.rules;

import java.util.Objects;

/**
 * Canonicalizes entity names and applies the exclusion predicate.
 */
public class ObservationNormalizer {

    private final NormalizationEngine engine;
    private final ExclusionPolicy exclusionPolicy;

    public ObservationNormalizer(NormalizationEngine engine, ExclusionPolicy exclusionPolicy) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.exclusionPolicy = Objects.requireNonNull(exclusionPolicy, "exclusionPolicy is required");
    }

    /**
     * Default suffix rules and the default exclusion list.
     */
    public static ObservationNormalizer createDefault() {
        return new ObservationNormalizer(
                DefaultNormalizationRules.createDefaultEngine(),
                SubstringExclusionPolicy.createDefault());
    }

    public String normalize(String rawName) {
        return engine.normalize(rawName);
    }

    public boolean isExcluded(String rawName) {
        return exclusionPolicy.isExcluded(rawName);
    }

    public ExclusionPolicy getExclusionPolicy() {
        return exclusionPolicy;
    }
}
