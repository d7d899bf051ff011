package com.arbor.lookup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LoanPurposeTest {

    @ParameterizedTest(name = "''{0}'' -> {1}")
    @CsvSource({
            "home,       HOME",
            "car,        CAR",
            "education,  EDUCATION",
            "EDUCATION,  EDUCATION",
            "' Car ',    CAR"
    })
    @DisplayName("Resolves values and constant names ignoring case")
    void fromValue(String text, LoanPurpose expected) {
        assertEquals(expected, LoanPurpose.fromValue(text).orElseThrow());
    }

    @Test
    @DisplayName("Unknown text resolves to nothing")
    void unknown() {
        assertTrue(LoanPurpose.fromValue("boat").isEmpty());
        assertEquals("car", LoanPurpose.CAR.value());
    }
}
