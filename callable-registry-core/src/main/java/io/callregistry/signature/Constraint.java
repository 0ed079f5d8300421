package io.callregistry.signature;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Condition one positional argument must satisfy for a signature to apply.
 *
 * <ul>
 *   <li>{@link ExactType} - the argument's runtime class equals the declared type.</li>
 *   <li>{@link SubtypeOf} - the argument is an instance of the declared type.</li>
 *   <li>{@link ValuePredicate} - an arbitrary test over the argument value.</li>
 * </ul>
 *
 * <p>Primitive classes are normalized to their wrapper types, so
 * {@code exact(int.class)} and {@code exact(Integer.class)} are the same constraint.
 * Constraints are compared by value; a predicate constraint is equal to another
 * only when both the description and the predicate instance are the same.
 *
 * @see Signature
 */
public sealed interface Constraint permits Constraint.ExactType, Constraint.SubtypeOf, Constraint.ValuePredicate {

    static ExactType exact(Class<?> type) {
        return new ExactType(type);
    }

    static SubtypeOf subtypeOf(Class<?> type) {
        return new SubtypeOf(type);
    }

    @SuppressWarnings("unchecked")
    static ValuePredicate predicate(String description, Predicate<?> predicate) {
        return new ValuePredicate(description, (Predicate<Object>) predicate);
    }

    /**
     * Short human-readable form used in signatures and error messages.
     */
    String describe();

    /**
     * Matches arguments whose runtime class is exactly {@code type}.
     *
     * @param type the declared type, never null
     */
    record ExactType(Class<?> type) implements Constraint {
        public ExactType {
            type = Types.wrap(Objects.requireNonNull(type, "type"));
        }

        @Override
        public String describe() {
            return "=" + type.getSimpleName();
        }
    }

    /**
     * Matches arguments that are instances of {@code type}, including {@code type} itself.
     *
     * @param type the declared type, never null
     */
    record SubtypeOf(Class<?> type) implements Constraint {
        public SubtypeOf {
            type = Types.wrap(Objects.requireNonNull(type, "type"));
        }

        @Override
        public String describe() {
            return type.getSimpleName();
        }
    }

    /**
     * Matches arguments accepted by {@code predicate}. The predicate is called with
     * the raw argument, which may be {@code null}.
     *
     * @param description name shown in signatures and error messages, never empty
     * @param predicate   the test, never null
     */
    record ValuePredicate(String description, Predicate<Object> predicate) implements Constraint {
        public ValuePredicate {
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(predicate, "predicate");
            if (description.isEmpty()) {
                throw new IllegalArgumentException("Predicate description cannot be empty");
            }
        }

        @Override
        public String describe() {
            return "?" + description;
        }
    }
}
