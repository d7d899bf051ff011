package com.arbor.input;

/**
 * How a question node is bound to one of the supplied inputs.
 */
public enum BindingMode {

    /** Only the node's declared {@code variable} is consulted. */
    DECLARED,

    /**
     * Declared variable first; nodes without one fall back to matching normalized input names
     * against the question text. When several names match, the first in the context's
     * insertion order wins, so the outcome depends on the caller.
     */
    DECLARED_WITH_SUBSTRING_FALLBACK
}
