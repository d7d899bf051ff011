package com.arbor.lookup;

/**
 * Derived cardiology inputs.
 */
public final class Hemodynamics {

    static final int HYPOTENSIVE_SYSTOLIC = 90;
    static final double HYPOTENSIVE_MAP = 65;
    static final int TACHYCARDIC_HEART_RATE = 100;
    static final double SHOCK_INDEX_LIMIT = 0.7;

    private Hemodynamics() {
    }

    /**
     * Mean arterial pressure, {@code (2 * diastolic + systolic) / 3}.
     */
    public static double meanArterialPressure(int systolic, int diastolic) {
        return ((2.0 * diastolic) + systolic) / 3.0;
    }

    /**
     * Shock index, heart rate over systolic pressure.
     */
    public static double shockIndex(int systolic, int heartRate) {
        if (systolic <= 0) {
            throw new IllegalArgumentException("Systolic pressure must be positive, got " + systolic);
        }
        return (double) heartRate / systolic;
    }

    /**
     * A patient is stable when neither hypotensive (SBP &lt; 90 or MAP &lt; 65) nor tachycardic
     * (HR &gt; 100), with a shock index below 0.7.
     */
    public static boolean isStable(int systolic, int diastolic, int heartRate) {
        boolean hypotension = systolic < HYPOTENSIVE_SYSTOLIC
                || meanArterialPressure(systolic, diastolic) < HYPOTENSIVE_MAP;
        boolean tachycardia = heartRate > TACHYCARDIC_HEART_RATE;
        return !hypotension && !tachycardia && shockIndex(systolic, heartRate) < SHOCK_INDEX_LIMIT;
    }
}
