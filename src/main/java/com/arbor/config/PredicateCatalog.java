package com.arbor.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Named predicates that YAML trees can reference with {@code predicate: <name>},
 * since a tree file cannot carry code of its own.
 */
public class PredicateCatalog {

    private final Map<String, Predicate<Object>> predicates = new LinkedHashMap<>();

    public static PredicateCatalog empty() {
        return new PredicateCatalog();
    }

    @SuppressWarnings("unchecked")
    public PredicateCatalog register(String name, Predicate<?> predicate) {
        predicates.put(name, (Predicate<Object>) predicate);
        return this;
    }

    public Optional<Predicate<Object>> get(String name) {
        return Optional.ofNullable(predicates.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(predicates.keySet());
    }
}
