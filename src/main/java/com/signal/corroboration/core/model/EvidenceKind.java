package com.signal.corroboration.core.model;

import java.util.Locale;

/**
 * The kind of proof an observation represents, independent of the source that produced it.
 * The number of distinct kinds behind an entity is its corroboration score.
 */
public enum EvidenceKind {
    REFERENCE("reference"),
    ANNOUNCEMENT("announcement"),
    CASE_STUDY("case-study"),
    HIRING_SIGNAL("hiring-signal"),
    PROCUREMENT("procurement"),
    EVENT_MENTION("event-mention");

    private final String label;

    EvidenceKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a wire label ("case-study") or enum name ("CASE_STUDY"), case-insensitively.
     *
     * @throws IllegalArgumentException if the value matches no kind
     */
    public static EvidenceKind fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("evidence kind must not be blank");
        }
        String candidate = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (EvidenceKind kind : values()) {
            if (kind.label.equals(candidate)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown evidence kind: " + value);
    }
}
