package com.arbor.tree;

/**
 * Matching criterion attached to one outgoing edge of a question node.
 * Classified once when the tree is built, see {@link BranchKeyClassifier}.
 */
public sealed interface BranchKey permits PredicateKey, OperatorMatch, LiteralKey {

    BranchKind kind();
}
