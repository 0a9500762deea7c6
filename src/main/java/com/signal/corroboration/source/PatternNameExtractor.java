package com.signal.corroboration.source;

import com.signal.corroboration.rules.ExclusionPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a name with an ordered list of regular expressions; the first capture group of the
 * first pattern producing an acceptable candidate wins.
 *
 * <p>A candidate is acceptable when it is longer than the minimum length and not excluded.
 * Leading filler words ("how", "why", "when", "as") are stripped. Optionally the beginning of
 * the text itself is returned when no pattern matches.</p>
 */
public class PatternNameExtractor implements NameExtractor {

    private static final Pattern LEADING_FILLER = Pattern.compile("^(how|why|when|as)\\s+", Pattern.CASE_INSENSITIVE);
    private static final int MAX_NAME_LENGTH = 80;

    private final List<Pattern> patterns;
    private final int minLength;
    private final ExclusionPolicy exclusionPolicy;
    private final int fallbackLength;

    private PatternNameExtractor(Builder builder) {
        this.patterns = List.copyOf(builder.patterns);
        this.minLength = builder.minLength;
        this.exclusionPolicy = builder.exclusionPolicy;
        this.fallbackLength = builder.fallbackLength;
    }

    @Override
    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find() || matcher.groupCount() < 1 || matcher.group(1) == null) {
                continue;
            }
            String candidate = LEADING_FILLER.matcher(matcher.group(1).trim()).replaceFirst("").trim();
            if (candidate.length() > minLength && !exclusionPolicy.isExcluded(candidate)) {
                return Optional.of(truncate(candidate, MAX_NAME_LENGTH));
            }
        }
        if (fallbackLength > 0) {
            return Optional.of(truncate(text.trim(), fallbackLength));
        }
        return Optional.empty();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max).trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Pattern> patterns = new ArrayList<>();
        private int minLength = 2;
        private ExclusionPolicy exclusionPolicy = ExclusionPolicy.NONE;
        private int fallbackLength;

        /**
         * Adds a case-insensitive pattern whose first group captures the name.
         */
        public Builder pattern(String regex) {
            this.patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            return this;
        }

        public Builder patterns(List<String> regexes) {
            regexes.forEach(this::pattern);
            return this;
        }

        /**
         * Candidates must be strictly longer than this.
         */
        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder exclusionPolicy(ExclusionPolicy exclusionPolicy) {
            this.exclusionPolicy = Objects.requireNonNull(exclusionPolicy, "exclusionPolicy is required");
            return this;
        }

        /**
         * When positive, the first {@code length} characters of the text are returned
         * if no pattern matches.
         */
        public Builder fallbackToText(int length) {
            this.fallbackLength = length;
            return this;
        }

        public PatternNameExtractor build() {
            return new PatternNameExtractor(this);
        }
    }
}
