package io.callregistry;

import io.callregistry.dispatch.DispatchInterceptor;
import io.callregistry.dispatch.Invoker;
import io.callregistry.dispatch.Resolver;
import io.callregistry.registry.DefaultEntryRegistry;
import io.callregistry.registry.EntryRegistry;
import io.callregistry.registry.RegistrationHandle;
import io.callregistry.registry.RegistryEntry;
import io.callregistry.signature.Signature;
import io.callregistry.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that binds several implementations to one operation name and picks
 * one per call from the runtime types or values of the arguments.
 *
 * <p>A registry is an explicit instance: create it once and pass it to every
 * registration and dispatch site. Independent registries never share state.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CallableRegistry<Double> shapes = CallableRegistry.<Double>builder()
 *     .name("shapes")
 *     .build();
 *
 * shapes.register("area", Signature.of(Circle.class),
 *     inv -> Math.PI * Math.pow(inv.argument(0, Circle.class).radius(), 2));
 * shapes.register("area", Signature.of(Shape.class),
 *     inv -> inv.argument(0, Shape.class).boundingBoxArea());
 *
 * shapes.dispatch("area", new Circle(2));   // Circle implementation
 * shapes.dispatch("area", new Square(3));   // Shape implementation
 * shapes.dispatch("area", 42);              // NoMatchException
 * }</pre>
 *
 * <h2>Resolution</h2>
 * <p>Every registration whose {@link Signature} accepts the arguments is scored
 * per position (exact type, then closest supertype, then predicate) and the
 * single best one wins. A tie raises {@link AmbiguousDispatchException}.
 *
 * <h2>Thread Safety</h2>
 * <p>All methods may be called concurrently. Dispatch reads an immutable snapshot
 * of the key's registrations and takes no lock.
 *
 * @see Signature
 * @see Registration
 * @see CallTarget
 */
public final class CallableRegistry<R> {
    private static final Logger logger = Logger.getLogger(CallableRegistry.class.getName());

    private final String name;
    private final boolean bindMetadata;
    private final EntryRegistry<R> entries;
    private final Resolver resolver;
    private final Invoker invoker;
    private final MetricsExporter metrics;

    private CallableRegistry(Builder<R> builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.bindMetadata = builder.bindMetadata;
        this.entries = builder.entryRegistry != null ? builder.entryRegistry : new DefaultEntryRegistry<>();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.resolver = new Resolver();
        this.invoker = new Invoker(builder.interceptors, metrics);
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    public String name() {
        return name;
    }

    /**
     * Returns whether registration metadata is passed to targets as invocation options.
     */
    public boolean bindMetadata() {
        return bindMetadata;
    }

    public RegistrationHandle register(String key, Signature signature, CallTarget<R> target) {
        return register(Registration.<R>builder(key).signature(signature).target(target).build());
    }

    public RegistrationHandle register(OperationKey key, Signature signature, CallTarget<R> target) {
        return register(Registration.<R>builder(key).signature(signature).target(target).build());
    }

    /**
     * Registers {@code target} under {@code key}.
     *
     * @param override replace an active registration with an identical signature
     * @throws DuplicateRegistrationException if the signature is already active and override is false
     */
    public RegistrationHandle register(String key, Signature signature, CallTarget<R> target, boolean override) {
        return register(Registration.<R>builder(key)
                .signature(signature)
                .target(target)
                .override(override)
                .build());
    }

    /**
     * Registers a fully described registration.
     *
     * @return a handle that unregisters exactly this registration
     * @throws DuplicateRegistrationException if the signature is already active and override is false
     */
    public RegistrationHandle register(Registration<R> registration) {
        RegistrationHandle handle = entries.register(registration);
        metrics.incrementRegistered();
        if (handle.replacedPrevious()) {
            metrics.incrementOverridden();
        }
        metrics.recordActiveEntries(entries.size());
        return handle;
    }

    /**
     * Removes the registration behind {@code handle}. Idempotent.
     *
     * @return {@code true} if this call removed it
     */
    public boolean unregister(RegistrationHandle handle) {
        boolean removed = entries.unregister(handle);
        if (removed) {
            metrics.incrementUnregistered();
            metrics.recordActiveEntries(entries.size());
        }
        return removed;
    }

    /**
     * Removes every registration of {@code key} at once. Their handles become inert;
     * the key stays known, so a later dispatch raises {@link NoMatchException}.
     *
     * @return the number of registrations removed
     * @throws UnknownKeyException if nothing was ever registered under key
     */
    public int remove(String key) {
        int removed = entries.removeAll(key);
        for (int i = 0; i < removed; i++) {
            metrics.incrementUnregistered();
        }
        if (removed > 0) {
            metrics.recordActiveEntries(entries.size());
        }
        return removed;
    }

    public int remove(OperationKey key) {
        return remove(key.name());
    }

    /**
     * Returns the active entries of {@code key} in registration order.
     *
     * @throws UnknownKeyException if nothing was ever registered under key
     */
    public List<RegistryEntry<R>> lookup(String key) {
        return entries.lookup(key);
    }

    public List<RegistryEntry<R>> lookup(OperationKey key) {
        return lookup(key.name());
    }

    /**
     * Returns the signatures currently registered under {@code key}, in registration order.
     *
     * @throws UnknownKeyException if nothing was ever registered under key
     */
    public List<Signature> signatures(String key) {
        List<Signature> result = new ArrayList<>();
        for (RegistryEntry<R> entry : entries.lookup(key)) {
            result.add(entry.signature());
        }
        return Collections.unmodifiableList(result);
    }

    public List<Signature> signatures(OperationKey key) {
        return signatures(key.name());
    }

    /**
     * Returns signature and metadata of each registration under {@code key}, in registration order.
     *
     * @throws UnknownKeyException if nothing was ever registered under key
     */
    public List<RegistrationInfo> describe(String key) {
        List<RegistrationInfo> result = new ArrayList<>();
        for (RegistryEntry<R> entry : entries.lookup(key)) {
            result.add(new RegistrationInfo(entry.signature(), entry.metadata(), entry.override()));
        }
        return Collections.unmodifiableList(result);
    }

    public List<RegistrationInfo> describe(OperationKey key) {
        return describe(key.name());
    }

    /**
     * Returns the sorted names of keys that currently have at least one registration.
     */
    public List<String> availableKeys() {
        List<String> keys = new ArrayList<>();
        for (String key : entries.keys()) {
            if (contains(key)) {
                keys.add(key);
            }
        }
        Collections.sort(keys);
        return Collections.unmodifiableList(keys);
    }

    /**
     * Returns whether {@code key} currently has at least one registration.
     */
    public boolean contains(String key) {
        try {
            return !entries.lookup(key).isEmpty();
        } catch (UnknownKeyException e) {
            return false;
        }
    }

    public boolean contains(OperationKey key) {
        return contains(key.name());
    }

    /**
     * Returns the number of active registrations across all keys.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the entry that a dispatch with these arguments would invoke, without invoking it.
     *
     * @throws UnknownKeyException        if nothing was ever registered under key
     * @throws NoMatchException           if no registration accepts the arguments
     * @throws AmbiguousDispatchException if several registrations tie
     */
    public RegistryEntry<R> resolve(String key, Object... args) {
        return select(key, Arguments.of(args));
    }

    public RegistryEntry<R> resolve(OperationKey key, Object... args) {
        return select(key.name(), Arguments.of(args));
    }

    /**
     * Resolves now and returns a {@link Callable} that invokes the winning target later
     * with the same arguments.
     */
    public Callable<R> bind(String key, Object... args) {
        return doBind(StringOperationKey.of(key), Map.of(), Arguments.of(args));
    }

    public Callable<R> bind(OperationKey key, Object... args) {
        return doBind(key, Map.of(), Arguments.of(args));
    }

    /**
     * Like {@link #bind(String, Object...)}, fixing call-site options as well. The options
     * are laid over the entry's metadata when the registry binds metadata.
     */
    public Callable<R> bindWithOptions(String key, Map<String, ?> options, Object... args) {
        return doBind(StringOperationKey.of(key), options, Arguments.of(args));
    }

    public Callable<R> bindWithOptions(OperationKey key, Map<String, ?> options, Object... args) {
        return doBind(key, options, Arguments.of(args));
    }

    /**
     * Invokes the most specific registration of {@code key} that accepts {@code args}.
     *
     * @return the target's result, unchanged
     * @throws UnknownKeyException        if nothing was ever registered under key
     * @throws NoMatchException           if no registration accepts the arguments
     * @throws AmbiguousDispatchException if several registrations tie
     * @throws Exception                  whatever the selected target throws
     */
    public R dispatch(String key, Object... args) throws Exception {
        return doDispatch(StringOperationKey.of(key), Map.of(), Arguments.of(args));
    }

    public R dispatch(OperationKey key, Object... args) throws Exception {
        return doDispatch(key, Map.of(), Arguments.of(args));
    }

    /**
     * Like {@link #dispatch(String, Object...)}, passing call-site options to the target.
     *
     * @param options options visible through {@link Invocation#options()}; names mapped to
     *                {@code null} are treated as absent
     */
    public R dispatchWithOptions(String key, Map<String, ?> options, Object... args) throws Exception {
        return doDispatch(StringOperationKey.of(key), options, Arguments.of(args));
    }

    public R dispatchWithOptions(OperationKey key, Map<String, ?> options, Object... args) throws Exception {
        return doDispatch(key, options, Arguments.of(args));
    }

    private R doDispatch(OperationKey key, Map<String, ?> options, Arguments args) throws Exception {
        Objects.requireNonNull(options, "options");
        RegistryEntry<R> entry = select(key.name(), args);
        logger.log(Level.FINE, "Selected {0} for {1}", new Object[]{entry, args});
        return invoker.invoke(entry, invocationFor(key, entry, args, options));
    }

    private Callable<R> doBind(OperationKey key, Map<String, ?> options, Arguments args) {
        Objects.requireNonNull(options, "options");
        RegistryEntry<R> entry = select(key.name(), args);
        Invocation invocation = invocationFor(key, entry, args, options);
        return () -> invoker.invoke(entry, invocation);
    }

    private RegistryEntry<R> select(String key, Arguments args) {
        List<RegistryEntry<R>> snapshot;
        try {
            snapshot = entries.lookup(key);
        } catch (UnknownKeyException e) {
            metrics.incrementUnknownKey();
            throw e;
        }
        try {
            return resolver.resolve(key, snapshot, args);
        } catch (NoMatchException e) {
            metrics.incrementNoMatch();
            throw e;
        } catch (AmbiguousDispatchException e) {
            metrics.incrementAmbiguous();
            throw e;
        }
    }

    private Invocation invocationFor(OperationKey key, RegistryEntry<R> entry, Arguments args,
                                     Map<String, ?> options) {
        Map<String, Object> merged = new HashMap<>();
        if (bindMetadata) {
            merged.putAll(entry.metadata());
        }
        options.forEach((name, value) -> {
            if (value != null) {
                merged.put(name, value);
            }
        });
        return new Invocation(key, entry.signature(), args, merged);
    }

    @Override
    public String toString() {
        return "CallableRegistry(name=" + name
                + ", bindMetadata=" + bindMetadata
                + ", keys=" + availableKeys() + ")";
    }

    public static final class Builder<R> {
        private String name = "default";
        private boolean bindMetadata;
        private EntryRegistry<R> entryRegistry;
        private MetricsExporter metrics;
        private final List<DispatchInterceptor> interceptors = new ArrayList<>();

        private Builder() {
        }

        public Builder<R> name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Passes each registration's metadata to its target as invocation options,
         * underneath any call-site options.
         */
        public Builder<R> bindMetadata(boolean bindMetadata) {
            this.bindMetadata = bindMetadata;
            return this;
        }

        /**
         * Stores registrations in {@code entryRegistry} instead of a new {@link DefaultEntryRegistry}.
         */
        public Builder<R> entryRegistry(EntryRegistry<R> entryRegistry) {
            this.entryRegistry = entryRegistry;
            return this;
        }

        public Builder<R> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder<R> interceptor(DispatchInterceptor interceptor) {
            interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public Builder<R> interceptors(List<DispatchInterceptor> interceptors) {
            interceptors.forEach(this::interceptor);
            return this;
        }

        public CallableRegistry<R> build() {
            return new CallableRegistry<>(this);
        }
    }
}
