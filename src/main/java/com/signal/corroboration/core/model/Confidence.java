package com.signal.corroboration.core.model;

import java.util.Locale;

/**
 * Ordinal confidence attached to an observation.
 * Ordered HIGH > MEDIUM > LOW; an absent confidence ranks below LOW.
 */
public enum Confidence {
    HIGH("High", 3),
    MEDIUM("Medium", 2),
    LOW("Low", 1);

    private final String label;
    private final int rank;

    Confidence(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Rank of a possibly absent confidence; {@code null} ranks 0.
     */
    public static int rankOf(Confidence confidence) {
        return confidence == null ? 0 : confidence.rank;
    }

    /**
     * Returns the higher-ranked of the two, preferring {@code current} on ties.
     */
    public static Confidence max(Confidence current, Confidence incoming) {
        return rankOf(incoming) > rankOf(current) ? incoming : current;
    }

    public static Confidence fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("confidence must not be blank");
        }
        String candidate = value.trim().toUpperCase(Locale.ROOT);
        for (Confidence confidence : values()) {
            if (confidence.name().equals(candidate)) {
                return confidence;
            }
        }
        throw new IllegalArgumentException("Unknown confidence: " + value);
    }
}
