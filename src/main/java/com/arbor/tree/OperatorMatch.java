package com.arbor.tree;

import java.util.Objects;

/**
 * Branch key comparing the input against a reference with a registered operator,
 * e.g. {@code (">=", 640)}.
 *
 * @param symbol    Operator symbol, resolved against the registry at evaluation time
 * @param reference Reference value
 */
public record OperatorMatch(String symbol, Object reference) implements BranchKey {

    public OperatorMatch {
        Objects.requireNonNull(symbol, "symbol");
    }

    public static OperatorMatch of(String symbol, Object reference) {
        return new OperatorMatch(symbol, reference);
    }

    @Override
    public BranchKind kind() {
        return BranchKind.OPERATOR_MATCH;
    }

    @Override
    public String toString() {
        return "(" + symbol + ", " + reference + ")";
    }
}
