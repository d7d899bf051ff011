package com.arbor.operator;

import com.arbor.tree.IntRange;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Value coercion shared by the standard operators and by literal branch keys.
 */
public final class Values {

    private Values() {
    }

    /**
     * Lenient equality: exact equality, numeric equality across boxed types,
     * or an enum constant compared to text naming it.
     */
    public static boolean looselyEqual(Object actual, Object expected) {
        if (Objects.equals(actual, expected)) {
            return true;
        }
        if (actual == null || expected == null) {
            return false;
        }
        // Handle numeric comparisons across types
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.doubleValue() == e.doubleValue();
        }
        if (actual instanceof Enum<?> a && expected instanceof CharSequence e) {
            return enumMatches(a, e.toString());
        }
        if (expected instanceof Enum<?> e && actual instanceof CharSequence a) {
            return enumMatches(e, a.toString());
        }
        return false;
    }

    private static boolean enumMatches(Enum<?> constant, String text) {
        return constant.name().equalsIgnoreCase(text) || constant.toString().equalsIgnoreCase(text);
    }

    /**
     * Order two values. Numbers compare by value, numeric text is coerced when the other side
     * is a number, and otherwise both sides must be mutually comparable.
     *
     * @throws IllegalArgumentException if the values cannot be ordered
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object left, Object right) {
        if (left instanceof Number || right instanceof Number) {
            Optional<Double> l = toDouble(left);
            Optional<Double> r = toDouble(right);
            if (l.isPresent() && r.isPresent()) {
                return Double.compare(l.get(), r.get());
            }
        }
        if (left instanceof Comparable c && right != null && left.getClass().isInstance(right)) {
            return c.compareTo(right);
        }
        throw new IllegalArgumentException("Cannot order " + describeType(left) + " against " + describeType(right));
    }

    /**
     * Membership test over collections, arrays, map keys, integer ranges and text.
     *
     * @throws IllegalArgumentException if the container type is not supported
     */
    public static boolean contains(Object container, Object value) {
        if (container instanceof IntRange range) {
            if (value instanceof Number n) {
                return range.contains(n.doubleValue());
            }
            return toDouble(value).map(range::contains).orElse(false);
        }
        if (container instanceof Collection<?> collection) {
            for (Object candidate : collection) {
                if (looselyEqual(value, candidate)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map<?, ?> map) {
            return contains(map.keySet(), value);
        }
        if (container != null && container.getClass().isArray()) {
            int length = Array.getLength(container);
            for (int i = 0; i < length; i++) {
                if (looselyEqual(value, Array.get(container, i))) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof CharSequence text) {
            return value != null && text.toString().contains(String.valueOf(value));
        }
        throw new IllegalArgumentException("Membership requires a collection, array, map, range or text, got "
                + describeType(container));
    }

    /**
     * Convert a value to a double, accepting boxed numbers and numeric text.
     */
    public static Optional<Double> toDouble(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Double d) {
            return Optional.of(d);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String describeType(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
