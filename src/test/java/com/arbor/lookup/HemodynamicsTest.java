package com.arbor.lookup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class HemodynamicsTest {

    @Test
    @DisplayName("Mean arterial pressure weights diastolic twice")
    void meanArterialPressure() {
        assertEquals(93.333, Hemodynamics.meanArterialPressure(120, 80), 0.001);
        assertEquals(60.0, Hemodynamics.meanArterialPressure(90, 45), 0.001);
    }

    @Test
    @DisplayName("Shock index requires a positive systolic pressure")
    void shockIndex() {
        assertEquals(0.6, Hemodynamics.shockIndex(120, 72), 0.0001);
        assertThrows(IllegalArgumentException.class, () -> Hemodynamics.shockIndex(0, 72));
    }

    @ParameterizedTest(name = "SBP {0}, DBP {1}, HR {2} -> stable {3}")
    @CsvSource({
            "120, 80, 72, true",
            "85, 60, 72, false",    // hypotensive systolic
            "90, 45, 60, false",    // MAP 60
            "120, 80, 110, false",  // tachycardic
            "100, 70, 75, false",   // shock index 0.75
            "90, 60, 62, true"
    })
    @DisplayName("Stability combines hypotension, tachycardia and shock index")
    void isStable(int systolic, int diastolic, int heartRate, boolean expected) {
        assertEquals(expected, Hemodynamics.isStable(systolic, diastolic, heartRate));
    }
}
