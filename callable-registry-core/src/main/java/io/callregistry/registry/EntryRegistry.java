package io.callregistry.registry;

import io.callregistry.Registration;

import java.util.List;
import java.util.Set;

/**
 * Owns the mapping from operation key to its registered entries.
 *
 * <p>Implementations must publish each key's entries as immutable snapshots:
 * a lookup running concurrently with a mutation observes the entry list either
 * entirely before or entirely after it. Entries are issued to callers through
 * {@link RegistrationHandle}s owned by the implementation.
 *
 * @param <R> the result type of registered targets
 * @see DefaultEntryRegistry
 */
public interface EntryRegistry<R> {

    /**
     * Adds an entry.
     *
     * @param registration what to register
     * @return a handle that can unregister exactly this entry
     * @throws io.callregistry.DuplicateRegistrationException if an identical signature is
     *         active under the key and override was not requested
     */
    RegistrationHandle register(Registration<R> registration);

    /**
     * Removes the entry behind {@code handle} if it is still present.
     *
     * @param handle a handle issued by this registry
     * @return {@code true} if an entry was removed, {@code false} if it was already gone
     * @throws IllegalArgumentException if the handle was issued by another registry
     */
    boolean unregister(RegistrationHandle handle);

    /**
     * Removes every entry of {@code key} in one step. The key stays known, so a later
     * {@link #lookup} returns an empty list.
     *
     * @param key the operation key name
     * @return the number of entries removed
     * @throws io.callregistry.UnknownKeyException if nothing was ever registered under key
     */
    int removeAll(String key);

    /**
     * Returns the active entries of {@code key} in registration order.
     *
     * @param key the operation key name
     * @return an immutable snapshot, empty if every entry has been removed
     * @throws io.callregistry.UnknownKeyException if nothing was ever registered under key
     */
    List<RegistryEntry<R>> lookup(String key);

    /**
     * Returns every key that has had at least one registration.
     */
    Set<String> keys();

    /**
     * Returns the number of active entries across all keys.
     */
    int size();

    /**
     * Returns whether {@code entry} is currently registered in this registry.
     */
    boolean isActive(RegistryEntry<?> entry);
}
