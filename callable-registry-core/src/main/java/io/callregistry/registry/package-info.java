/**
 * Registration storage keyed by operation name.
 *
 * <p>{@link io.callregistry.registry.EntryRegistry} owns the per-key entry lists and
 * publishes them as immutable snapshots; {@link io.callregistry.registry.RegistrationHandle}
 * lets the registering caller remove exactly its own entry.
 *
 * @see io.callregistry.registry.DefaultEntryRegistry
 */
package io.callregistry.registry;
