package com.arbor.tree;

/**
 * Half-open integer range {@code [from, to)} usable as the reference of an {@code in} / {@code not in}
 * branch key, e.g. systolic pressure in {@code [130, 140)}.
 *
 * @param from inclusive lower bound
 * @param to   exclusive upper bound
 */
public record IntRange(long from, long to) {

    public IntRange {
        if (to < from) {
            throw new IllegalArgumentException("Range upper bound " + to + " is below lower bound " + from);
        }
    }

    public static IntRange of(long from, long to) {
        return new IntRange(from, to);
    }

    /**
     * Check whether a whole number lies within the range.
     */
    public boolean contains(long value) {
        return value >= from && value < to;
    }

    /**
     * Check whether a numeric value lies within the range.
     * Fractional values never match, mirroring integer range membership.
     */
    public boolean contains(double value) {
        return value == Math.rint(value) && value >= from && value < to;
    }

    @Override
    public String toString() {
        return "[" + from + ".." + to + ")";
    }
}
