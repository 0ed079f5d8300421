package io.callregistry.registry;

import io.callregistry.signature.Signature;

import java.util.Objects;

/**
 * Returned by registration; unregisters exactly the entry it was issued for.
 *
 * <p>A handle becomes inert once its entry is gone, whether it was unregistered
 * or retired by an overriding registration. Unregistering an inert handle is a
 * no-op.
 */
public final class RegistrationHandle {

    private final EntryRegistry<?> owner;
    private final RegistryEntry<?> entry;
    private final boolean replacedPrevious;

    /**
     * Creates a handle for {@code entry}. Called by {@link EntryRegistry} implementations.
     *
     * @param owner            the registry that holds the entry
     * @param entry            the registered entry
     * @param replacedPrevious whether registering it retired an identical signature
     */
    public RegistrationHandle(EntryRegistry<?> owner, RegistryEntry<?> entry, boolean replacedPrevious) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.entry = Objects.requireNonNull(entry, "entry");
        this.replacedPrevious = replacedPrevious;
    }

    public String key() {
        return entry.key();
    }

    public Signature signature() {
        return entry.signature();
    }

    /**
     * Returns whether this registration retired an earlier one with the same signature.
     */
    public boolean replacedPrevious() {
        return replacedPrevious;
    }

    public boolean isActive() {
        return owner.isActive(entry);
    }

    /**
     * Removes the entry from its registry.
     *
     * @return {@code true} if the entry was removed by this call
     */
    public boolean unregister() {
        return owner.unregister(this);
    }

    /**
     * Returns the registry that issued this handle.
     */
    public EntryRegistry<?> owner() {
        return owner;
    }

    public RegistryEntry<?> entry() {
        return entry;
    }

    @Override
    public String toString() {
        return "RegistrationHandle[" + entry + (isActive() ? "" : ", inactive") + "]";
    }
}
