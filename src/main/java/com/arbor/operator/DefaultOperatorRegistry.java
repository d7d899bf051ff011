package com.arbor.operator;

import com.arbor.exception.AuthoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of OperatorRegistry, pre-populated with the {@link StandardOperator} table.
 */
public class DefaultOperatorRegistry implements OperatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultOperatorRegistry.class);

    private final Map<String, ComparisonOperator> operators = new ConcurrentHashMap<>();

    public DefaultOperatorRegistry() {
        for (StandardOperator operator : StandardOperator.values()) {
            operators.put(operator.symbol(), operator);
        }
        log.debug("OperatorRegistry initialized with {} standard operators", operators.size());
    }

    @Override
    public void register(String symbol, ComparisonOperator operator) {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(operator, "operator");
        ComparisonOperator previous = operators.put(symbol, operator);
        if (previous != null) {
            log.info("Operator '{}' overwritten", symbol);
        } else {
            log.info("Operator '{}' registered", symbol);
        }
    }

    @Override
    public ComparisonOperator lookup(String symbol) {
        ComparisonOperator operator = symbol == null ? null : operators.get(symbol);
        if (operator == null) {
            throw new AuthoringException("Unsupported operator '" + symbol + "'. Register it first.");
        }
        return operator;
    }

    @Override
    public boolean contains(String symbol) {
        return symbol != null && operators.containsKey(symbol);
    }

    @Override
    public Set<String> symbols() {
        return Collections.unmodifiableSet(new TreeSet<>(operators.keySet()));
    }
}
