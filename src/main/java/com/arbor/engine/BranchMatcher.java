package com.arbor.engine;

import com.arbor.input.ResolvedInput;
import com.arbor.operator.OperatorRegistry;
import com.arbor.operator.Values;
import com.arbor.tree.Branch;
import com.arbor.tree.BranchKey;
import com.arbor.tree.LiteralKey;
import com.arbor.tree.OperatorMatch;
import com.arbor.tree.PredicateKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Selects the branch of a question node that accepts a resolved input.
 * <p>
 * Rules:
 * - Branches are tried in authoring order
 * - First accepting branch wins, even if a later one would also accept
 * - One trace entry per branch tried, up to and including the match
 * - Exceptions raised by operators or predicates are not caught
 */
public class BranchMatcher {

    private static final Logger log = LoggerFactory.getLogger(BranchMatcher.class);

    private final OperatorRegistry operatorRegistry;

    public BranchMatcher(OperatorRegistry operatorRegistry) {
        this.operatorRegistry = operatorRegistry;
    }

    /**
     * Find the first branch accepting the input.
     *
     * @param branches Branches of the current node
     * @param input    Resolved input
     * @param trace    Trace of the current evaluation (appended to)
     * @return Selected branch, or {@link BranchMatch#none()}
     */
    public BranchMatch match(List<Branch> branches, ResolvedInput input, Trace trace) {
        Object value = input.value();
        for (int i = 0; i < branches.size(); i++) {
            Branch branch = branches.get(i);
            BranchKey key = branch.key();

            boolean accepted = accepts(key, value);
            String entry = "Checked " + input.subject() + ": " + describe(key, value)
                    + (accepted ? " -> matched" : " -> no match");
            trace.add(entry);
            log.trace("Branch {} of {}: {}", i + 1, branches.size(), entry);

            if (accepted) {
                return BranchMatch.of(branch, i + 1);
            }
        }
        return BranchMatch.none();
    }

    private boolean accepts(BranchKey key, Object value) {
        return switch (key.kind()) {
            case PREDICATE -> ((PredicateKey) key).test(value);
            case OPERATOR_MATCH -> {
                OperatorMatch match = (OperatorMatch) key;
                yield operatorRegistry.lookup(match.symbol()).test(value, match.reference());
            }
            case LITERAL -> Values.looselyEqual(value, ((LiteralKey) key).value());
        };
    }

    private String describe(BranchKey key, Object value) {
        return switch (key.kind()) {
            case PREDICATE -> "predicate " + ((PredicateKey) key).name();
            case OPERATOR_MATCH -> {
                OperatorMatch match = (OperatorMatch) key;
                yield Trace.render(value) + " " + match.symbol() + " " + Trace.render(match.reference());
            }
            case LITERAL -> Trace.render(value) + " == " + Trace.render(((LiteralKey) key).value());
        };
    }
}
