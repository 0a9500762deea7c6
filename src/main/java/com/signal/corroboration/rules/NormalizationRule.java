package com.signal.corroboration.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A rule for normalizing entity names using regex pattern matching.
 * Rules are ordered by priority (lower number = tried first).
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.replacement = builder.replacement;
        this.priority = builder.priority;
    }

    /**
     * Creates a rule stripping a trailing legal-entity suffix such as "LLC" or "Holdings".
     * The suffix only matches as a separate trailing word, optionally preceded by a comma,
     * and longer suffixes get a smaller priority number so they are tried first.
     */
    public static NormalizationRule legalSuffix(String suffix) {
        Objects.requireNonNull(suffix, "suffix is required");
        String trimmed = suffix.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("suffix must not be blank");
        }
        return builder()
                .name("suffix-" + trimmed.toLowerCase(Locale.ROOT))
                .pattern(",?\\s+" + Pattern.quote(trimmed) + "$")
                .replacement("")
                .priority(100 - trimmed.length())
                .build();
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Applies this rule to the given input string.
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
