package com.arbor.tree;

/**
 * A node of a decision tree: either a question to answer or a terminal leaf.
 */
public sealed interface Node permits QuestionNode, Leaf {

    /**
     * Check if this node terminates descent.
     */
    default boolean isLeaf() {
        return this instanceof Leaf;
    }
}
