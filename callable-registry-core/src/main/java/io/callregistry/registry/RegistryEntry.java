package io.callregistry.registry;

import io.callregistry.CallTarget;
import io.callregistry.signature.Signature;

import java.util.Map;
import java.util.Objects;

/**
 * One registered (signature, target) pair under a key.
 *
 * <p>Entries are immutable and created only by an {@link EntryRegistry}. The
 * {@code sequence} is unique per registry and grows with every registration;
 * it fixes iteration order and lets error messages name registrations.
 *
 * @param key       the operation key name
 * @param signature the argument constraints
 * @param target    the implementation
 * @param sequence  registration sequence number
 * @param override  whether this entry was registered with override requested
 * @param metadata  immutable registration metadata
 * @param <R>       the result type
 */
public record RegistryEntry<R>(String key, Signature signature, CallTarget<R> target,
                               long sequence, boolean override, Map<String, Object> metadata) {

    public RegistryEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(target, "target");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public String toString() {
        return key + signature + "#" + sequence;
    }
}
