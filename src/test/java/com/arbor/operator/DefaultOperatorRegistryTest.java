package com.arbor.operator;

import com.arbor.exception.AuthoringException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultOperatorRegistry.
 */
class DefaultOperatorRegistryTest {

    private DefaultOperatorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultOperatorRegistry();
    }

    @Test
    @DisplayName("Registry starts with the standard operators")
    void startsWithStandardOperators() {
        assertEquals(Set.of("==", "!=", ">", ">=", "<", "<=", "in", "not in", "regex"), registry.symbols());
        assertSame(StandardOperator.GREATER_THAN_OR_EQUALS, registry.lookup(">="));
    }

    @Test
    @DisplayName("Lookup of an unregistered symbol is an authoring error")
    void lookupUnknownSymbol() {
        AuthoringException e = assertThrows(AuthoringException.class, () -> registry.lookup("between"));
        assertTrue(e.getMessage().contains("between"));
        assertFalse(registry.contains("between"));
    }

    @Test
    @DisplayName("Registered operators are returned by lookup")
    void registerNewOperator() {
        ComparisonOperator startsWith = (input, reference) -> String.valueOf(input).startsWith(String.valueOf(reference));
        registry.register("starts with", startsWith);

        assertTrue(registry.contains("starts with"));
        assertTrue(registry.lookup("starts with").test("I10.9", "I10"));
    }

    @Test
    @DisplayName("Registering an existing symbol overwrites it")
    void registerOverwrites() {
        registry.register("==", (input, reference) -> true);

        assertTrue(registry.lookup("==").test(1, 2));
    }

    @Test
    @DisplayName("Null symbol or operator is rejected")
    void rejectNulls() {
        assertThrows(NullPointerException.class, () -> registry.register(null, (a, b) -> true));
        assertThrows(NullPointerException.class, () -> registry.register("x", null));
    }
}
