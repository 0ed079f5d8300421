package io.callregistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable positional argument list of one dispatch call.
 *
 * <p>Unlike {@link List#of}, {@code null} elements are allowed: a null argument
 * simply never satisfies a type constraint.
 */
public final class Arguments implements Iterable<Object> {

    private static final Arguments EMPTY = new Arguments(Collections.emptyList());

    private final List<Object> values;

    private Arguments(List<Object> values) {
        this.values = values;
    }

    /**
     * Creates an argument list, copying the given array.
     *
     * @param values the positional arguments; a null array means no arguments
     * @return the argument list
     */
    public static Arguments of(Object... values) {
        if (values == null || values.length == 0) {
            return EMPTY;
        }
        return new Arguments(Collections.unmodifiableList(Arrays.asList(values.clone())));
    }

    /**
     * Creates an argument list from a collection, preserving its iteration order.
     */
    public static Arguments copyOf(List<?> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new Arguments(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns the argument at {@code index}.
     *
     * @throws IndexOutOfBoundsException if index is outside {@code [0, size())}
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Returns the argument at {@code index} cast to {@code type}.
     *
     * @throws ClassCastException if the argument is not null and not an instance of type
     */
    public <T> T get(int index, Class<T> type) {
        return type.cast(values.get(index));
    }

    public List<Object> asList() {
        return values;
    }

    @Override
    public Iterator<Object> iterator() {
        return values.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arguments)) return false;
        return values.equals(((Arguments) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /**
     * Renders argument runtime types only, never values.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            Object value = values.get(i);
            sb.append(value == null ? "null" : value.getClass().getSimpleName());
        }
        return sb.append(')').toString();
    }
}
