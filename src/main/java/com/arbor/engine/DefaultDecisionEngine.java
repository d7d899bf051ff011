package com.arbor.engine;

import com.arbor.core.EvaluationContext;
import com.arbor.input.DefaultInputResolver;
import com.arbor.input.InputResolver;
import com.arbor.input.ResolvedInput;
import com.arbor.operator.DefaultOperatorRegistry;
import com.arbor.operator.OperatorRegistry;
import com.arbor.tree.DecisionTree;
import com.arbor.tree.Leaf;
import com.arbor.tree.Node;
import com.arbor.tree.QuestionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of DecisionEngine.
 * Walks the tree iteratively: resolve the input for the current question, pick the first
 * accepting branch, repeat until a leaf is reached.
 */
public class DefaultDecisionEngine implements DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultDecisionEngine.class);

    private final OperatorRegistry operatorRegistry;
    private final InputResolver inputResolver;
    private final BranchMatcher branchMatcher;

    public DefaultDecisionEngine() {
        this(new DefaultOperatorRegistry(), new DefaultInputResolver());
    }

    public DefaultDecisionEngine(OperatorRegistry operatorRegistry, InputResolver inputResolver) {
        this.operatorRegistry = Objects.requireNonNull(operatorRegistry, "operatorRegistry");
        this.inputResolver = Objects.requireNonNull(inputResolver, "inputResolver");
        this.branchMatcher = new BranchMatcher(operatorRegistry);
    }

    @Override
    public EvaluationResult evaluate(DecisionTree tree, EvaluationContext inputs) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(inputs, "inputs");
        log.debug("Evaluating tree '{}' v{} with inputs {}", tree.name(), tree.version(), inputs.names());

        Trace trace = new Trace();
        Node current = tree.root();

        while (current instanceof QuestionNode question) {
            Optional<ResolvedInput> input = inputResolver.resolve(question, inputs);
            if (input.isEmpty()) {
                log.warn("Tree '{}': question '{}' could not be answered", tree.name(), question.question());
                return EvaluationResult.error(
                        "Question '" + question.question() + "' could not be answered with supplied inputs.",
                        trace.entries());
            }

            ResolvedInput resolved = input.get();
            BranchMatch match = branchMatcher.match(question.branches(), resolved, trace);
            if (!match.isMatched()) {
                log.warn("Tree '{}': no branch of '{}' accepts {} = {}",
                        tree.name(), question.question(), resolved.name(), resolved.value());
                return EvaluationResult.error(
                        "Invalid value for " + resolved.subject() + ": " + Trace.render(resolved.value()),
                        trace.entries());
            }
            current = match.branch().target();
        }

        Leaf leaf = (Leaf) current;
        log.debug("Tree '{}' reached '{}' after {} checks", tree.name(), leaf.decision(), trace.size());
        return EvaluationResult.decided(leaf, trace.entries());
    }

    @Override
    public OperatorRegistry getOperatorRegistry() {
        return operatorRegistry;
    }
}
