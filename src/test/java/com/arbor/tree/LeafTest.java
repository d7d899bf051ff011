package com.arbor.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for leaf text parsing.
 */
class LeafTest {

    @Test
    @DisplayName("Leaf text splits into decision and reason")
    void splitsDecisionAndReason() {
        Leaf leaf = Leaf.parse("Approved - Strong income and credit score");

        assertEquals("Approved", leaf.decision());
        assertEquals("Strong income and credit score", leaf.reason());
    }

    @Test
    @DisplayName("Leaf text without separator gets the default reason")
    void defaultReason() {
        Leaf leaf = Leaf.parse("Observe.");

        assertEquals("Observe.", leaf.decision());
        assertEquals(Leaf.DEFAULT_REASON, leaf.reason());
        assertEquals("No specific reason provided.", leaf.reason());
    }

    @Test
    @DisplayName("Only the first separator splits")
    void splitsOnFirstSeparator() {
        Leaf leaf = Leaf.parse("Declined - Too high - see policy 4");

        assertEquals("Declined", leaf.decision());
        assertEquals("Too high - see policy 4", leaf.reason());
    }

    @Test
    @DisplayName("Hyphens without surrounding spaces do not split")
    void hyphenWithoutSpaces() {
        Leaf leaf = Leaf.parse("Elevated blood pressure-check again");

        assertEquals("Elevated blood pressure-check again", leaf.decision());
    }
}
