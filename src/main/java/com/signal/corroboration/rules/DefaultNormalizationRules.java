package com.signal.corroboration.rules;

import java.util.List;

/**
 * Built-in legal-entity suffixes stripped from organization names.
 */
public final class DefaultNormalizationRules {

    /**
     * Suffixes stripped from the end of a name. Order is irrelevant; the engine tries
     * longer suffixes first.
     */
    public static final List<String> LEGAL_SUFFIXES = List.of(
            "LLC", "Ltd", "Ltd.", "Inc", "Inc.", "Corp", "Group",
            "Holdings", "FZE", "WLL", "PJSC", "PSC", "BSC", "QSC",
            "Co.", "Company"
    );

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getLegalSuffixRules());
        return engine;
    }

    /**
     * Gets one stripping rule per legal suffix.
     */
    public static List<NormalizationRule> getLegalSuffixRules() {
        return LEGAL_SUFFIXES.stream()
                .map(NormalizationRule::legalSuffix)
                .toList();
    }
}
