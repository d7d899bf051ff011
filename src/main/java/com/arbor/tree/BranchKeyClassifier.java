package com.arbor.tree;

import com.arbor.exception.AuthoringException;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Classifies authored branch keys and child values when a tree is built.
 * <p>
 * Rules, first applicable wins:
 * <ul>
 *   <li>an existing {@link BranchKey} is kept</li>
 *   <li>a {@link Predicate} becomes a {@link PredicateKey}</li>
 *   <li>a two-element list or array whose first element is text becomes an {@link OperatorMatch}</li>
 *   <li>anything else becomes a {@link LiteralKey}</li>
 * </ul>
 * Only {@link Predicate} is recognized as code; a {@link Function} key is an authoring error.
 */
public final class BranchKeyClassifier {

    static final String ANONYMOUS_PREDICATE = "anonymous";

    private BranchKeyClassifier() {
    }

    /**
     * Classify a raw branch key.
     */
    public static BranchKey classify(Object raw) {
        if (raw instanceof BranchKey key) {
            return key;
        }
        if (raw instanceof Predicate<?> predicate) {
            return PredicateKey.of(ANONYMOUS_PREDICATE, predicate);
        }
        if (raw instanceof Function<?, ?>) {
            throw new AuthoringException("Branch key is a Function; use a java.util.function.Predicate instead");
        }
        if (raw instanceof List<?> list && list.size() == 2 && list.get(0) instanceof CharSequence symbol) {
            return new OperatorMatch(symbol.toString(), list.get(1));
        }
        if (raw != null && raw.getClass().isArray() && Array.getLength(raw) == 2
                && Array.get(raw, 0) instanceof CharSequence symbol) {
            return new OperatorMatch(symbol.toString(), Array.get(raw, 1));
        }
        return new LiteralKey(raw);
    }

    /**
     * Classify a raw child value.
     * A map carrying {@code question} or {@code branches} must be a well-formed question node;
     * any other value is a leaf.
     */
    public static Node node(Object raw) {
        if (raw instanceof Node node) {
            return node;
        }
        if (raw instanceof QuestionNode.Builder builder) {
            return builder.build();
        }
        if (raw instanceof Map<?, ?> map && (map.containsKey("question") || map.containsKey("branches"))) {
            return questionFromMap(map);
        }
        return Leaf.parse(String.valueOf(raw));
    }

    private static QuestionNode questionFromMap(Map<?, ?> map) {
        Object question = map.get("question");
        Object branches = map.get("branches");
        if (!(question instanceof CharSequence)) {
            throw new AuthoringException("Malformed node: 'question' must be text, got " + question);
        }
        if (!(branches instanceof Map<?, ?> branchMap)) {
            throw new AuthoringException("Malformed node '" + question + "': 'branches' must be a mapping");
        }
        Object variable = map.get("variable");
        QuestionNode.Builder builder = QuestionNode.builder(question.toString())
                .variable(variable == null ? null : variable.toString());
        for (Map.Entry<?, ?> entry : branchMap.entrySet()) {
            builder.branch(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }
}
