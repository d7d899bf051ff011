package com.arbor.tree;

import java.util.Objects;

/**
 * A named, immutable decision tree.
 *
 * @param name    Tree name used for catalog lookups
 * @param version Authoring version
 * @param root    Root node
 */
public record DecisionTree(
        String name,
        String version,
        Node root
) {
    public DecisionTree {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(root, "root");
        if (version == null || version.isBlank()) {
            version = "1.0";
        }
    }

    public static DecisionTree of(String name, Node root) {
        return new DecisionTree(name, null, root);
    }

    public static DecisionTree of(String name, QuestionNode.Builder root) {
        return new DecisionTree(name, null, root.build());
    }
}
