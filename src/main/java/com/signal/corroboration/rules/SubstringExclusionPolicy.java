package com.signal.corroboration.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Exclusion against a static list of disallowed names.
 *
 * <p>A name is excluded when, after trimming, lower-casing and collapsing whitespace, it equals
 * an entry, contains an entry, or is contained in an entry. The two-way substring match is
 * aggressive: short entries such as "ey" or "hp" suppress any name containing them, and short
 * names such as "world" are suppressed by any entry containing them. Blank names are always
 * excluded.</p>
 */
public class SubstringExclusionPolicy implements ExclusionPolicy {
    private static final Logger log = LoggerFactory.getLogger(SubstringExclusionPolicy.class);

    private final Set<String> entries;

    public SubstringExclusionPolicy(Collection<String> entries) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (String entry : entries) {
            if (entry != null && !entry.isBlank()) {
                cleaned.add(NormalizationEngine.clean(entry));
            }
        }
        this.entries = Set.copyOf(cleaned);
    }

    /**
     * Creates a policy over {@link DefaultExclusions#ENTRIES}.
     */
    public static SubstringExclusionPolicy createDefault() {
        return new SubstringExclusionPolicy(DefaultExclusions.ENTRIES);
    }

    @Override
    public boolean isExcluded(String name) {
        Optional<String> match = matchingEntry(name);
        match.ifPresent(entry -> log.debug("exclusion.matched name='{}' entry='{}'", name, entry));
        return match.isPresent() || name == null || name.isBlank();
    }

    /**
     * Returns the disallowed entry responsible for excluding {@code name}, if any.
     * Exact matches win over substring matches.
     */
    public Optional<String> matchingEntry(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String candidate = NormalizationEngine.clean(name);
        if (entries.contains(candidate)) {
            return Optional.of(candidate);
        }
        for (String entry : entries) {
            if (candidate.contains(entry) || entry.contains(candidate)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public Set<String> getEntries() {
        return entries;
    }
}
