package com.arbor.tree;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Branch key that accepts a value when a single-argument predicate returns true.
 *
 * @param name      Name shown in trace entries
 * @param predicate Predicate applied to the resolved input
 */
public record PredicateKey(String name, Predicate<Object> predicate) implements BranchKey {

    public PredicateKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
    }

    @SuppressWarnings("unchecked")
    public static PredicateKey of(String name, Predicate<?> predicate) {
        return new PredicateKey(name, (Predicate<Object>) predicate);
    }

    public boolean test(Object value) {
        return predicate.test(value);
    }

    @Override
    public BranchKind kind() {
        return BranchKind.PREDICATE;
    }

    @Override
    public String toString() {
        return "predicate " + name;
    }
}
