package io.callregistry.signature;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Ordered list of per-argument {@link Constraint}s defining when a registration applies.
 *
 * <p>The arity is fixed when the signature is built. Two signatures are identical
 * when their constraint lists are equal, which is what duplicate detection uses.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Accept subtypes at every position (the common case)
 * Signature shapes = Signature.of(Shape.class);
 *
 * // Mix constraint kinds
 * Signature sig = Signature.builder()
 *     .exact(Circle.class)
 *     .subtypeOf(Number.class)
 *     .predicate("positive", v -> v instanceof Integer i && i > 0)
 *     .build();
 * }</pre>
 */
public record Signature(List<Constraint> constraints) {

    private static final Signature EMPTY = new Signature(List.of());

    public Signature {
        constraints = List.copyOf(Objects.requireNonNull(constraints, "constraints"));
    }

    /**
     * Signature accepting the given types or any of their subtypes, one per position.
     */
    public static Signature of(Class<?>... types) {
        List<Constraint> constraints = new ArrayList<>(types.length);
        for (Class<?> type : types) {
            constraints.add(Constraint.subtypeOf(type));
        }
        return new Signature(constraints);
    }

    /**
     * Signature requiring exactly the given runtime types, one per position.
     */
    public static Signature exactly(Class<?>... types) {
        List<Constraint> constraints = new ArrayList<>(types.length);
        for (Class<?> type : types) {
            constraints.add(Constraint.exact(type));
        }
        return new Signature(constraints);
    }

    public static Signature of(Constraint... constraints) {
        return new Signature(List.of(constraints));
    }

    /**
     * Signature of an operation taking no arguments.
     */
    public static Signature empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int arity() {
        return constraints.size();
    }

    public Constraint constraint(int position) {
        return constraints.get(position);
    }

    @Override
    public String toString() {
        return constraints.stream()
                .map(Constraint::describe)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    public static final class Builder {
        private final List<Constraint> constraints = new ArrayList<>();

        private Builder() {
        }

        public Builder exact(Class<?> type) {
            constraints.add(Constraint.exact(type));
            return this;
        }

        public Builder subtypeOf(Class<?> type) {
            constraints.add(Constraint.subtypeOf(type));
            return this;
        }

        public Builder predicate(String description, Predicate<?> predicate) {
            constraints.add(Constraint.predicate(description, predicate));
            return this;
        }

        public Builder constraint(Constraint constraint) {
            constraints.add(Objects.requireNonNull(constraint, "constraint"));
            return this;
        }

        public Signature build() {
            return new Signature(constraints);
        }
    }
}
