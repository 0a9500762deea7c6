package com.signal.corroboration.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObservationNormalizerTest {

    @Test
    @DisplayName("Default normalizer should combine suffix rules and default exclusions")
    void testDefaults() {
        ObservationNormalizer normalizer = ObservationNormalizer.createDefault();

        assertEquals("acme energy", normalizer.normalize("Acme Energy LLC"));
        assertTrue(normalizer.isExcluded("SAP"));
        assertFalse(normalizer.isExcluded("Acme Energy LLC"));
    }

    @Test
    @DisplayName("Should use the supplied engine and policy")
    void testCustomCollaborators() {
        ObservationNormalizer normalizer = new ObservationNormalizer(
                new NormalizationEngine(), new SubstringExclusionPolicy(List.of("acme")));

        assertEquals("acme energy llc", normalizer.normalize("Acme Energy LLC"));
        assertTrue(normalizer.isExcluded("Acme Energy LLC"));
    }

    @Test
    @DisplayName("NONE policy should exclude nothing")
    void testNoExclusions() {
        assertFalse(ExclusionPolicy.NONE.isExcluded("SAP"));
    }
}
