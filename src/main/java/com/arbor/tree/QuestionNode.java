package com.arbor.tree;

import com.arbor.exception.AuthoringException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A question answered by one named input, with branches tried in authoring order.
 *
 * @param question Question text shown to reviewers, also used by the legacy substring binding
 * @param variable Declared name of the input answering this question (null if undeclared)
 * @param branches Branches in authoring order
 */
public record QuestionNode(
        String question,
        String variable,
        List<Branch> branches
) implements Node {

    public QuestionNode {
        if (question == null || question.isBlank()) {
            throw new AuthoringException("Question node requires question text");
        }
        if (branches == null || branches.isEmpty()) {
            throw new AuthoringException("Question '" + question + "' has no branches");
        }
        if (variable != null && variable.isBlank()) {
            variable = null;
        }
        branches = List.copyOf(branches);
    }

    /**
     * Get the declared input binding, if the author provided one.
     */
    public Optional<String> declaredVariable() {
        return Optional.ofNullable(variable);
    }

    /**
     * Create a new builder.
     */
    public static Builder builder(String question) {
        return new Builder(question);
    }

    /**
     * Builder for QuestionNode. Branch keys and children are classified as they are added.
     */
    public static class Builder {
        private final String question;
        private String variable;
        private final List<Branch> branches = new ArrayList<>();

        private Builder(String question) {
            this.question = question;
        }

        public Builder variable(String variable) {
            this.variable = variable;
            return this;
        }

        /**
         * Add a branch.
         *
         * @param rawKey Predicate, {@code List.of(symbol, reference)}, {@link BranchKey} or literal
         * @param child  Node, Builder, or leaf text
         */
        public Builder branch(Object rawKey, Object child) {
            branches.add(new Branch(BranchKeyClassifier.classify(rawKey), BranchKeyClassifier.node(child)));
            return this;
        }

        public QuestionNode build() {
            return new QuestionNode(question, variable, branches);
        }
    }
}
