package com.arbor.input;

import com.arbor.core.EvaluationContext;
import com.arbor.tree.QuestionNode;

import java.util.Optional;

/**
 * Binds a question node to one of the caller-supplied inputs.
 */
public interface InputResolver {

    /**
     * Resolve the input answering a question.
     *
     * @param node    Question being answered
     * @param context Inputs of the current evaluation
     * @return Bound input, or empty if no input answers the question
     */
    Optional<ResolvedInput> resolve(QuestionNode node, EvaluationContext context);

    /**
     * Turn an input name into the readable term used in trace entries,
     * e.g. {@code loan_purpose} becomes {@code loan purpose}.
     */
    static String subjectOf(String name) {
        return name.replace('_', ' ').replace('-', ' ');
    }
}
