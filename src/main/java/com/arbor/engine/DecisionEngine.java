package com.arbor.engine;

import com.arbor.core.EvaluationContext;
import com.arbor.operator.ComparisonOperator;
import com.arbor.operator.OperatorRegistry;
import com.arbor.tree.DecisionTree;

import java.util.Map;

/**
 * Evaluates decision trees against named inputs.
 * <p>
 * Evaluation is a pure function of the tree, the inputs and the operator registry:
 * it performs no I/O and keeps no state between calls, so any number of evaluations may
 * run concurrently once all operator registrations are complete.
 */
public interface DecisionEngine {

    /**
     * Descend the tree from root to leaf.
     *
     * @param tree   Tree to evaluate
     * @param inputs Named inputs answering the tree's questions
     * @return Decision reached, or an Error result when the inputs cannot answer a question
     *         or match none of its branches
     * @throws com.arbor.exception.AuthoringException if the tree uses an unregistered operator
     */
    EvaluationResult evaluate(DecisionTree tree, EvaluationContext inputs);

    /**
     * Evaluate with inputs given as a map. The map's iteration order is kept.
     */
    default EvaluationResult evaluate(DecisionTree tree, Map<String, ?> inputs) {
        return evaluate(tree, EvaluationContext.of(inputs));
    }

    /**
     * Register an operator. Must complete before any evaluation relying on the symbol.
     */
    default void registerOperator(String symbol, ComparisonOperator operator) {
        getOperatorRegistry().register(symbol, operator);
    }

    /**
     * Get the registry backing operator-match branch keys.
     */
    OperatorRegistry getOperatorRegistry();
}
