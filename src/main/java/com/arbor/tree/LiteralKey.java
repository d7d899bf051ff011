package com.arbor.tree;

/**
 * Branch key accepting values equal to a literal, including enum constants.
 *
 * @param value Literal to compare against
 */
public record LiteralKey(Object value) implements BranchKey {

    public static LiteralKey of(Object value) {
        return new LiteralKey(value);
    }

    @Override
    public BranchKind kind() {
        return BranchKind.LITERAL;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
