package com.arbor.operator;

import java.util.Set;

/**
 * Table of named comparison operators used by operator-match branch keys.
 * <p>
 * Write-once then read-many: every registration a tree depends on must complete before
 * evaluations that use it begin. Registering a symbol while evaluations are looking it up
 * is outside the contract.
 */
public interface OperatorRegistry {

    /**
     * Insert or overwrite an operator.
     *
     * @param symbol   Operator symbol as written in trees
     * @param operator Operator implementation, trusted as-is
     */
    void register(String symbol, ComparisonOperator operator);

    /**
     * Look up an operator.
     *
     * @param symbol Operator symbol
     * @return Registered operator
     * @throws com.arbor.exception.AuthoringException if nothing is registered under the symbol
     */
    ComparisonOperator lookup(String symbol);

    /**
     * Check whether a symbol is registered.
     */
    boolean contains(String symbol);

    /**
     * Get all registered symbols.
     */
    Set<String> symbols();
}
