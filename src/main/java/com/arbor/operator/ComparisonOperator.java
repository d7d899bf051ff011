package com.arbor.operator;

/**
 * A named binary predicate used by operator-match branch keys.
 * Implementations are trusted: no arity or type checking happens before they are applied,
 * and anything they throw reaches the caller of the engine unchanged.
 */
@FunctionalInterface
public interface ComparisonOperator {

    /**
     * Apply the operator.
     *
     * @param input     Resolved input value
     * @param reference Reference value authored in the branch key
     * @return true if the branch accepts the input
     */
    boolean test(Object input, Object reference);
}
