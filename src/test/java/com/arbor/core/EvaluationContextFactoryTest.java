package com.arbor.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationContextFactoryTest {

    // =====================================================================
    // JSON Inputs
    // =====================================================================

    @Test
    @DisplayName("Parses fields in document order")
    void parsesInOrder() {
        EvaluationContext context = EvaluationContextFactory.fromJson(
                "{\"income\": 60000, \"credit_score\": 700, \"purpose\": \"CAR\"}");

        assertEquals(List.of("income", "credit_score", "purpose"), List.copyOf(context.names()));
        assertEquals(700, context.get("credit_score").orElseThrow());
        assertEquals("CAR", context.get("purpose").orElseThrow());
    }

    @Test
    @DisplayName("Flattens nested objects with dot notation and keeps lists whole")
    void flattensNestedObjects() {
        EvaluationContext context = EvaluationContextFactory.fromJson(
                "{\"patient\": {\"vitals\": {\"hr\": 72}}, \"countries\": [\"US\", \"Canada\"]}");

        assertEquals(72, context.get("patient.vitals.hr").orElseThrow());
        assertEquals(List.of("US", "Canada"), context.get("countries").orElseThrow());
    }

    @Test
    @DisplayName("Drops null fields")
    void dropsNulls() {
        EvaluationContext context = EvaluationContextFactory.fromJson("{\"a\": null, \"b\": true}");

        assertFalse(context.get("a").isPresent());
        assertEquals(Boolean.TRUE, context.get("b").orElseThrow());
    }

    @Test
    @DisplayName("Blank input gives an empty context")
    void blankInput() {
        assertTrue(EvaluationContextFactory.fromJson("").names().isEmpty());
        assertTrue(EvaluationContextFactory.fromJson(null).names().isEmpty());
    }

    @Test
    @DisplayName("Malformed JSON is rejected")
    void malformedJson() {
        assertThrows(IllegalArgumentException.class, () -> EvaluationContextFactory.fromJson("{credit_score: }"));
        assertThrows(IllegalArgumentException.class, () -> EvaluationContextFactory.fromJson("[1, 2]"));
    }

    // =====================================================================
    // Builder
    // =====================================================================

    @Test
    @DisplayName("Context is immutable")
    void immutable() {
        EvaluationContext context = EvaluationContext.of(Map.of("x", 1));

        assertThrows(UnsupportedOperationException.class, () -> context.asMap().put("y", 2));
    }
}
