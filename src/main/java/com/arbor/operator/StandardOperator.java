package com.arbor.operator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Operators every registry starts with.
 */
public enum StandardOperator implements ComparisonOperator {
    // Comparison
    EQUALS("==") {
        @Override
        public boolean test(Object input, Object reference) {
            return Values.looselyEqual(input, reference);
        }
    },
    NOT_EQUALS("!=") {
        @Override
        public boolean test(Object input, Object reference) {
            return !Values.looselyEqual(input, reference);
        }
    },
    GREATER_THAN(">") {
        @Override
        public boolean test(Object input, Object reference) {
            return Values.compare(input, reference) > 0;
        }
    },
    GREATER_THAN_OR_EQUALS(">=") {
        @Override
        public boolean test(Object input, Object reference) {
            return Values.compare(input, reference) >= 0;
        }
    },
    LESS_THAN("<") {
        @Override
        public boolean test(Object input, Object reference) {
            return Values.compare(input, reference) < 0;
        }
    },
    LESS_THAN_OR_EQUALS("<=") {
        @Override
        public boolean test(Object input, Object reference) {
            return Values.compare(input, reference) <= 0;
        }
    },

    // Collection
    IN("in") {
        @Override
        public boolean test(Object input, Object reference) {
            return Values.contains(reference, input);
        }
    },
    NOT_IN("not in") {
        @Override
        public boolean test(Object input, Object reference) {
            return !Values.contains(reference, input);
        }
    },

    // String
    REGEX("regex") {
        @Override
        public boolean test(Object input, Object reference) {
            Pattern pattern = reference instanceof Pattern p
                    ? p
                    : PATTERNS.computeIfAbsent(String.valueOf(reference), Pattern::compile);
            return pattern.matcher(String.valueOf(input)).matches();
        }
    };

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private final String symbol;

    StandardOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Symbol used in operator-match branch keys, e.g. {@code ">="} or {@code "not in"}.
     */
    public String symbol() {
        return symbol;
    }
}
