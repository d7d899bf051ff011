package com.arbor.core;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named input values supplied to one evaluation.
 * Immutable after creation; iteration order is insertion order.
 */
public interface EvaluationContext {

    /**
     * Get an input value.
     *
     * @param name Input name
     * @return Input value, or empty if not supplied
     */
    Optional<Object> get(String name);

    /**
     * Get input names in insertion order.
     */
    Set<String> names();

    /**
     * Get all inputs in insertion order.
     */
    Map<String, Object> asMap();

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultEvaluationContext.Builder();
    }

    /**
     * Create a context from a map, keeping the map's iteration order.
     */
    static EvaluationContext of(Map<String, ?> inputs) {
        return builder().inputs(inputs).build();
    }

    /**
     * Builder for EvaluationContext.
     */
    interface Builder {
        Builder input(String name, Object value);
        Builder inputs(Map<String, ?> inputs);
        EvaluationContext build();
    }
}
