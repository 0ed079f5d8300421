package io.callregistry.match;

/**
 * How precisely one argument satisfied its positional constraint.
 *
 * <p>Declared from weakest to strongest; {@link #rank()} grows with precision.
 */
public enum MatchQuality {
    /** Accepted by a value predicate only. */
    PREDICATE,
    /** Instance of a proper supertype of its runtime class. */
    SUBTYPE,
    /** Runtime class equals the declared type. */
    EXACT;

    public int rank() {
        return ordinal();
    }
}
