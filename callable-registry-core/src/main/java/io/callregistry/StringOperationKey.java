package io.callregistry;

import java.util.Objects;

/**
 * A simple string-based operation key for dynamic scenarios.
 *
 * <pre>{@code
 * OperationKey area = StringOperationKey.of("area");
 * registry.register(area, Signature.of(Circle.class), inv -> ...);
 * }</pre>
 */
public final class StringOperationKey implements OperationKey {

    private final String name;

    private StringOperationKey(String name) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Operation key name cannot be empty");
        }
    }

    /**
     * Creates an operation key from a string.
     *
     * @param name the operation name
     * @return the key
     * @throws NullPointerException     if name is null
     * @throws IllegalArgumentException if name is empty
     */
    public static StringOperationKey of(String name) {
        return new StringOperationKey(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringOperationKey)) return false;
        StringOperationKey that = (StringOperationKey) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
