package com.signal.corroboration.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
    }

    @ParameterizedTest
    @DisplayName("Should strip legal suffixes")
    @CsvSource({
            "Acme Energy LLC,acme energy",
            "Acme Energy Ltd,acme energy",
            "Acme Energy Ltd.,acme energy",
            "Acme Energy Inc.,acme energy",
            "Acme Energy Corp,acme energy",
            "Globex Trading Co.,globex trading",
            "Gulf Cement Company,gulf cement",
            "Initech Foods PJSC,initech foods",
            "Harbor Bank BSC,harbor bank",
            "Desert Power FZE,desert power",
            "Pearl Hospital WLL,pearl hospital",
            "Oasis Water QSC,oasis water",
            "Riyadh Textiles PSC,riyadh textiles"
    })
    void testLegalSuffixes(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Should strip a suffix preceded by a comma")
    void testCommaBeforeSuffix() {
        assertEquals("acme energy", engine.normalize("Acme Energy, LLC"));
    }

    @Test
    @DisplayName("Should strip stacked suffixes down to the fixed point")
    void testStackedSuffixes() {
        assertEquals("umbrella mining", engine.normalize("Umbrella Mining Holdings Group LLC"));
    }

    @Test
    @DisplayName("Should only strip suffixes at the end of the name")
    void testSuffixInMiddleIsKept() {
        assertEquals("group four logistics", engine.normalize("Group Four Logistics"));
        assertEquals("holdings bank of doha", engine.normalize("Holdings Bank of Doha"));
    }

    @Test
    @DisplayName("Should lower-case and collapse whitespace")
    void testCaseAndWhitespace() {
        assertEquals("acme energy", engine.normalize("  ACME    Energy\t"));
    }

    @ParameterizedTest
    @DisplayName("Normalization should be idempotent")
    @ValueSource(strings = {
            "Acme Energy LLC",
            "Umbrella Mining Holdings Group LLC",
            "Northwind Logistics, Ltd.",
            "  Contoso   RETAIL Company ",
            "Company",
            "Group Holdings"
    })
    void testIdempotence(String input) {
        String once = engine.normalize(input);
        assertEquals(once, engine.normalize(once));
    }

    @Test
    @DisplayName("Should treat differently suffixed names as equivalent")
    void testAreEquivalent() {
        assertTrue(engine.areEquivalent("Acme Energy LLC", "ACME ENERGY"));
        assertFalse(engine.areEquivalent("Acme Energy", "Acme Power"));
    }

    @Test
    @DisplayName("Should apply custom rules and allow their removal")
    void testCustomRules() {
        NormalizationEngine custom = new NormalizationEngine();
        custom.addRule(NormalizationRule.builder()
                .name("strip-the")
                .pattern("^the\\s+")
                .replacement("")
                .priority(10)
                .build());

        assertEquals("acme energy", custom.normalize("The Acme Energy"));
        assertTrue(custom.removeRule("strip-the"));
        assertEquals("the acme energy", custom.normalize("The Acme Energy"));
    }

    @Test
    @DisplayName("Should apply rules in priority order")
    void testRulePriority() {
        NormalizationEngine custom = new NormalizationEngine();
        custom.addRule(NormalizationRule.builder().name("late").pattern("x").replacement("late").priority(50).build());
        custom.addRule(NormalizationRule.builder().name("early").pattern("x").replacement("y").priority(1).build());

        assertEquals("early", custom.getRules().get(0).getName());
        assertEquals("y", custom.normalize("X"));
    }
}
