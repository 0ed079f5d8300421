package io.callregistry;

import io.callregistry.registry.RegistryEntry;
import io.callregistry.signature.Signature;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when two or more registrations tie for the highest specificity.
 *
 * <p>Ties are configuration errors: the registry never falls back to
 * registration order. The message names each tied signature with its
 * registration order so the conflict can be located.
 */
public final class AmbiguousDispatchException extends CallableRegistryException {

    private final String key;
    private final List<Signature> tiedSignatures;

    public AmbiguousDispatchException(String key, Arguments arguments, List<? extends RegistryEntry<?>> tied) {
        super("Ambiguous dispatch of '" + key + "' for arguments " + arguments + ": "
                + tied.stream()
                        .map(e -> e.signature() + " (registration #" + e.sequence() + ")")
                        .collect(Collectors.joining(", ")));
        this.key = key;
        this.tiedSignatures = tied.stream().<Signature>map(RegistryEntry::signature).toList();
    }

    public String key() {
        return key;
    }

    /**
     * Returns the tied signatures in registration order.
     */
    public List<Signature> tiedSignatures() {
        return tiedSignatures;
    }
}
