package io.callregistry.registry;

import io.callregistry.DuplicateRegistrationException;
import io.callregistry.Registration;
import io.callregistry.UnknownKeyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe, copy-on-write {@link EntryRegistry}.
 *
 * <p>Each key maps to an immutable list of entries. A mutation builds a new list
 * and swaps it in atomically for that key, so readers never lock and never see a
 * partially updated list. Mutations of different keys do not contend.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EntryRegistry<Double> registry = new DefaultEntryRegistry<>();
 * RegistrationHandle handle = registry.register(Registration.<Double>builder("area")
 *     .signature(Signature.of(Circle.class))
 *     .target(inv -> Math.PI * Math.pow(inv.argument(0, Circle.class).radius(), 2))
 *     .build());
 *
 * registry.lookup("area");   // [area(Circle)#1]
 * handle.unregister();
 * registry.lookup("area");   // []
 * }</pre>
 *
 * <p>Keys are never forgotten: once a key has been registered, {@link #lookup}
 * returns a (possibly empty) list for it instead of failing.
 */
public final class DefaultEntryRegistry<R> implements EntryRegistry<R> {
    private static final Logger logger = Logger.getLogger(DefaultEntryRegistry.class.getName());

    private final Map<String, List<RegistryEntry<R>>> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public RegistrationHandle register(Registration<R> registration) {
        Objects.requireNonNull(registration, "registration");
        String key = registration.key().name();
        AtomicReference<RegistryEntry<R>> retired = new AtomicReference<>();
        AtomicReference<RegistryEntry<R>> added = new AtomicReference<>();

        // compute() runs atomically per key; throwing leaves the mapping untouched
        entries.compute(key, (k, current) -> {
            List<RegistryEntry<R>> next = current == null ? new ArrayList<>() : new ArrayList<>(current);
            for (int i = 0; i < next.size(); i++) {
                RegistryEntry<R> existing = next.get(i);
                if (existing.signature().equals(registration.signature())) {
                    if (!registration.override()) {
                        throw new DuplicateRegistrationException(k, registration.signature());
                    }
                    retired.set(next.remove(i));
                    break;
                }
            }
            RegistryEntry<R> entry = new RegistryEntry<>(k, registration.signature(), registration.target(),
                    sequence.incrementAndGet(), registration.override(), registration.metadata());
            next.add(entry);
            added.set(entry);
            return Collections.unmodifiableList(next);
        });

        if (retired.get() != null) {
            logger.log(Level.FINE, "Retired {0}, replaced by {1}", new Object[]{retired.get(), added.get()});
        } else {
            logger.log(Level.FINE, "Registered {0}", added.get());
        }
        return new RegistrationHandle(this, added.get(), retired.get() != null);
    }

    @Override
    public boolean unregister(RegistrationHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (handle.owner() != this) {
            throw new IllegalArgumentException("Handle " + handle + " was issued by another registry");
        }
        RegistryEntry<?> target = handle.entry();
        AtomicBoolean removed = new AtomicBoolean();
        entries.computeIfPresent(target.key(), (k, current) -> {
            List<RegistryEntry<R>> next = new ArrayList<>(current.size());
            for (RegistryEntry<R> entry : current) {
                if (entry == target) {
                    removed.set(true);
                } else {
                    next.add(entry);
                }
            }
            return removed.get() ? Collections.unmodifiableList(next) : current;
        });
        if (removed.get()) {
            logger.log(Level.FINE, "Unregistered {0}", target);
        }
        return removed.get();
    }

    @Override
    public int removeAll(String key) {
        Objects.requireNonNull(key, "key");
        AtomicInteger removed = new AtomicInteger(-1);
        entries.computeIfPresent(key, (k, current) -> {
            removed.set(current.size());
            return List.of();
        });
        if (removed.get() < 0) {
            throw new UnknownKeyException(key);
        }
        logger.log(Level.FINE, "Removed {0} entries of {1}", new Object[]{removed.get(), key});
        return removed.get();
    }

    @Override
    public List<RegistryEntry<R>> lookup(String key) {
        Objects.requireNonNull(key, "key");
        List<RegistryEntry<R>> snapshot = entries.get(key);
        if (snapshot == null) {
            throw new UnknownKeyException(key);
        }
        return snapshot;
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    @Override
    public int size() {
        int total = 0;
        for (List<RegistryEntry<R>> snapshot : entries.values()) {
            total += snapshot.size();
        }
        return total;
    }

    @Override
    public boolean isActive(RegistryEntry<?> entry) {
        List<RegistryEntry<R>> snapshot = entries.get(entry.key());
        if (snapshot == null) {
            return false;
        }
        for (RegistryEntry<R> candidate : snapshot) {
            if (candidate == entry) {
                return true;
            }
        }
        return false;
    }
}
