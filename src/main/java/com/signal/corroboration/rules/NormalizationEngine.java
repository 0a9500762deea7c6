package com.signal.corroboration.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Engine for turning raw entity names into canonical keys.
 *
 * <p>The name is trimmed, lower-cased and whitespace-collapsed, then rules are applied one at a
 * time in priority order: whenever a rule changes the name, matching restarts from the first
 * rule. Normalization stops once no rule changes the name, so the output is a fixed point and
 * {@code normalize(normalize(x)).equals(normalize(x))} always holds.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_PASSES = 64;

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes the given name into a canonical key. Null or blank input yields "".
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = clean(name);

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = applyFirstMatchingRule(result);
            if (next == null) {
                return result;
            }
            result = next;
        }

        log.warn("normalize.passLimit name='{}' result='{}'", name, result);
        return result;
    }

    /**
     * Checks if two names share a canonical key.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }

    /**
     * Trims, lower-cases and collapses whitespace runs, without applying any rule.
     */
    static String clean(String value) {
        return WHITESPACE.matcher(value.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    private String applyFirstMatchingRule(String current) {
        for (NormalizationRule rule : rules) {
            String candidate = clean(rule.apply(current));
            if (!candidate.equals(current)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), current, candidate);
                return candidate;
            }
        }
        return null;
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
