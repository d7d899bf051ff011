package com.arbor.tree;

import java.util.Objects;

/**
 * One outgoing edge of a question node.
 *
 * @param key    Classified matching criterion
 * @param target Node reached when the key accepts the input
 */
public record Branch(BranchKey key, Node target) {

    public Branch {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(target, "target");
    }
}
