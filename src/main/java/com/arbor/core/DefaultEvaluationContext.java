package com.arbor.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default implementation of EvaluationContext.
 * Immutable after construction. Null names and values are dropped by the builder.
 */
public final class DefaultEvaluationContext implements EvaluationContext {

    private final Map<String, Object> inputs;

    private DefaultEvaluationContext(Builder builder) {
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputs));
    }

    @Override
    public Optional<Object> get(String name) {
        return Optional.ofNullable(inputs.get(name));
    }

    @Override
    public Set<String> names() {
        return inputs.keySet();
    }

    @Override
    public Map<String, Object> asMap() {
        return inputs;
    }

    @Override
    public String toString() {
        return "EvaluationContext{" + inputs + '}';
    }

    /**
     * Builder for DefaultEvaluationContext.
     */
    public static class Builder implements EvaluationContext.Builder {
        private final Map<String, Object> inputs = new LinkedHashMap<>();

        @Override
        public Builder input(String name, Object value) {
            if (name != null && value != null) {
                this.inputs.put(name, value);
            }
            return this;
        }

        @Override
        public Builder inputs(Map<String, ?> inputs) {
            if (inputs != null) {
                inputs.forEach(this::input);
            }
            return this;
        }

        @Override
        public EvaluationContext build() {
            return new DefaultEvaluationContext(this);
        }
    }
}
