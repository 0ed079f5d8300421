package io.callregistry.dispatch;

import io.callregistry.AmbiguousDispatchException;
import io.callregistry.Arguments;
import io.callregistry.NoMatchException;
import io.callregistry.match.SignatureMatcher;
import io.callregistry.match.Specificity;
import io.callregistry.registry.RegistryEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the single most specific entry for an argument list.
 *
 * <p>Resolution never falls back to registration order: if the best specificity
 * is shared, the call is rejected with {@link AmbiguousDispatchException}.
 * Stateless and safe for concurrent use.
 */
public final class Resolver {

    private final SignatureMatcher matcher;

    public Resolver() {
        this(SignatureMatcher.INSTANCE);
    }

    public Resolver(SignatureMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    /**
     * Resolves the winning entry.
     *
     * @param key     the operation key name, used in error messages
     * @param entries a snapshot of the key's entries
     * @param args    the call arguments
     * @return the unique most specific applicable entry
     * @throws NoMatchException           if no entry applies
     * @throws AmbiguousDispatchException if several entries tie for the best specificity
     */
    public <R> RegistryEntry<R> resolve(String key, List<RegistryEntry<R>> entries, Arguments args) {
        List<Candidate<R>> applicable = new ArrayList<>();
        for (RegistryEntry<R> entry : entries) {
            Optional<Specificity> specificity = matcher.matches(entry, args);
            specificity.ifPresent(s -> applicable.add(new Candidate<>(entry, s)));
        }
        if (applicable.isEmpty()) {
            throw new NoMatchException(key, args, entries.size());
        }

        applicable.sort(Comparator.comparing(Candidate<R>::specificity).reversed());
        Specificity best = applicable.get(0).specificity();
        List<RegistryEntry<R>> tied = new ArrayList<>();
        for (Candidate<R> candidate : applicable) {
            if (candidate.specificity().compareTo(best) != 0) {
                break;
            }
            tied.add(candidate.entry());
        }
        if (tied.size() > 1) {
            tied.sort(Comparator.comparingLong(RegistryEntry::sequence));
            throw new AmbiguousDispatchException(key, args, List.copyOf(tied));
        }
        return tied.get(0);
    }

    private record Candidate<R>(RegistryEntry<R> entry, Specificity specificity) {
    }
}
