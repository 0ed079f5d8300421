package io.callregistry.match;

import java.util.Arrays;

/**
 * Per-position match quality of one signature against one argument list.
 *
 * <p>Each position carries a {@link MatchQuality} and, for {@link MatchQuality#SUBTYPE},
 * the inheritance distance between the argument's runtime class and the declared
 * type. Vectors compare lexicographically from the first position: the first
 * position that differs decides, higher quality first, then shorter distance.
 * Scores are never summed, so {@code (EXACT, PREDICATE)} and
 * {@code (PREDICATE, EXACT)} are distinct and ordered.
 *
 * <p>{@link #compareTo} returns a positive value when this vector is
 * <em>more</em> specific than the other. Only vectors of equal length are comparable.
 */
public final class Specificity implements Comparable<Specificity> {

    private final MatchQuality[] qualities;
    private final int[] distances;

    Specificity(MatchQuality[] qualities, int[] distances) {
        this.qualities = qualities;
        this.distances = distances;
    }

    public int arity() {
        return qualities.length;
    }

    public MatchQuality quality(int position) {
        return qualities[position];
    }

    public int distance(int position) {
        return distances[position];
    }

    @Override
    public int compareTo(Specificity other) {
        if (other.qualities.length != qualities.length) {
            throw new IllegalArgumentException("Cannot compare specificity of arity "
                    + qualities.length + " with arity " + other.qualities.length);
        }
        for (int i = 0; i < qualities.length; i++) {
            int byQuality = Integer.compare(qualities[i].rank(), other.qualities[i].rank());
            if (byQuality != 0) {
                return byQuality;
            }
            int byDistance = Integer.compare(other.distances[i], distances[i]);
            if (byDistance != 0) {
                return byDistance;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Specificity)) return false;
        Specificity that = (Specificity) o;
        return Arrays.equals(qualities, that.qualities) && Arrays.equals(distances, that.distances);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(qualities) + Arrays.hashCode(distances);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < qualities.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(qualities[i]);
            if (qualities[i] == MatchQuality.SUBTYPE) {
                sb.append('(').append(distances[i]).append(')');
            }
        }
        return sb.append(']').toString();
    }
}
