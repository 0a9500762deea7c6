package com.signal.corroboration.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceTest {

    @Test
    @DisplayName("Should order HIGH over MEDIUM over LOW over absent")
    void testRanks() {
        assertTrue(Confidence.HIGH.getRank() > Confidence.MEDIUM.getRank());
        assertTrue(Confidence.MEDIUM.getRank() > Confidence.LOW.getRank());
        assertTrue(Confidence.rankOf(Confidence.LOW) > Confidence.rankOf(null));
    }

    @Test
    @DisplayName("max should keep the higher rank and prefer the current value on ties")
    void testMax() {
        assertEquals(Confidence.HIGH, Confidence.max(Confidence.LOW, Confidence.HIGH));
        assertEquals(Confidence.HIGH, Confidence.max(Confidence.HIGH, Confidence.MEDIUM));
        assertEquals(Confidence.LOW, Confidence.max(null, Confidence.LOW));
        assertEquals(Confidence.MEDIUM, Confidence.max(Confidence.MEDIUM, null));
        assertSame(Confidence.MEDIUM, Confidence.max(Confidence.MEDIUM, Confidence.MEDIUM));
    }

    @Test
    @DisplayName("Should parse labels case-insensitively")
    void testFromLabel() {
        assertEquals(Confidence.HIGH, Confidence.fromLabel("High"));
        assertEquals(Confidence.MEDIUM, Confidence.fromLabel("medium"));
        assertThrows(IllegalArgumentException.class, () -> Confidence.fromLabel("certain"));
    }
}
