package io.callregistry.match;

import io.callregistry.Arguments;
import io.callregistry.registry.RegistryEntry;
import io.callregistry.signature.Constraint;
import io.callregistry.signature.Signature;
import io.callregistry.signature.Types;

import java.util.Optional;

/**
 * Decides whether a signature applies to an argument list and how specifically.
 *
 * <p>Stateless and side-effect free apart from whatever caller-supplied value
 * predicates do; an exception thrown by a predicate propagates to the caller.
 * A single shared {@link #INSTANCE} is safe to use from any thread.
 */
public final class SignatureMatcher {

    public static final SignatureMatcher INSTANCE = new SignatureMatcher();

    private SignatureMatcher() {
    }

    /**
     * Matches a registered entry against concrete arguments.
     *
     * @param entry the candidate
     * @param args  the call arguments
     * @return the specificity, or empty if the entry does not apply
     */
    public Optional<Specificity> matches(RegistryEntry<?> entry, Arguments args) {
        return matches(entry.signature(), args);
    }

    public Optional<Specificity> matches(Signature signature, Arguments args) {
        int arity = signature.arity();
        if (args.size() != arity) {
            return Optional.empty();
        }
        MatchQuality[] qualities = new MatchQuality[arity];
        int[] distances = new int[arity];
        for (int i = 0; i < arity; i++) {
            Constraint constraint = signature.constraint(i);
            Object arg = args.get(i);
            if (constraint instanceof Constraint.ExactType exact) {
                if (arg == null || arg.getClass() != exact.type()) {
                    return Optional.empty();
                }
                qualities[i] = MatchQuality.EXACT;
            } else if (constraint instanceof Constraint.SubtypeOf subtype) {
                if (arg == null) {
                    return Optional.empty();
                }
                int distance = Types.distance(arg.getClass(), subtype.type());
                if (distance < 0) {
                    return Optional.empty();
                }
                // An instance of the declared type itself ranks as an exact match
                qualities[i] = distance == 0 ? MatchQuality.EXACT : MatchQuality.SUBTYPE;
                distances[i] = distance;
            } else if (constraint instanceof Constraint.ValuePredicate predicate) {
                if (!predicate.predicate().test(arg)) {
                    return Optional.empty();
                }
                qualities[i] = MatchQuality.PREDICATE;
            } else {
                throw new IllegalStateException("Unsupported constraint: " + constraint);
            }
        }
        return Optional.of(new Specificity(qualities, distances));
    }
}
