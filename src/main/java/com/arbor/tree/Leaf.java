package com.arbor.tree;

import java.util.Objects;

/**
 * Terminal decision of a tree.
 * <p>
 * Authored trees pack both fields into one text, {@code "<decision> - <reason>"};
 * {@link #parse(String)} is the only place that convention is applied.
 *
 * @param decision Decision label, e.g. "Approved"
 * @param reason   Justification shown alongside the decision
 */
public record Leaf(String decision, String reason) implements Node {

    public static final String SEPARATOR = " - ";
    public static final String DEFAULT_REASON = "No specific reason provided.";

    public Leaf {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(reason, "reason");
    }

    /**
     * Parse authored leaf text, splitting on the first separator.
     */
    public static Leaf parse(String text) {
        String value = text == null ? "" : text;
        int index = value.indexOf(SEPARATOR);
        if (index < 0) {
            return new Leaf(value, DEFAULT_REASON);
        }
        return new Leaf(value.substring(0, index), value.substring(index + SEPARATOR.length()));
    }

    @Override
    public String toString() {
        return decision + SEPARATOR + reason;
    }
}
