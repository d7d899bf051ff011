package com.arbor.engine;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Append-only record of the checks performed during one evaluation.
 * Local to a single call, never shared between threads.
 */
public final class Trace {

    private final List<String> entries = new ArrayList<>();

    public void add(String entry) {
        entries.add(entry);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Get an immutable snapshot of the entries in the order they were added.
     */
    public List<String> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Render a value for a trace entry. Text is single-quoted so that {@code '640'} and
     * {@code 640} read differently in an audit.
     */
    static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            return "'" + text + "'";
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Iterable<?> items) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            items.forEach(item -> joiner.add(render(item)));
            return joiner.toString();
        }
        if (value.getClass().isArray()) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (int i = 0; i < Array.getLength(value); i++) {
                joiner.add(render(Array.get(value, i)));
            }
            return joiner.toString();
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return String.join(" | ", entries);
    }
}
