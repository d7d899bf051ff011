package com.arbor.tree;

/**
 * The three shapes a branch key can take.
 */
public enum BranchKind {
    PREDICATE,
    OPERATOR_MATCH,
    LITERAL
}
