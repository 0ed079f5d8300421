package io.callregistry.micrometer;

import io.callregistry.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code callable.registry.dispatch.success}: targets that returned normally</li>
 *   <li>{@code callable.registry.dispatch.failure}: targets that threw</li>
 *   <li>{@code callable.registry.dispatch.no_match}: dispatches no registration accepted</li>
 *   <li>{@code callable.registry.dispatch.ambiguous}: dispatches rejected as ties</li>
 *   <li>{@code callable.registry.dispatch.unknown_key}: dispatches of unknown keys</li>
 *   <li>{@code callable.registry.registration.added}: successful registrations</li>
 *   <li>{@code callable.registry.registration.overridden}: registrations that retired an earlier one</li>
 *   <li>{@code callable.registry.registration.removed}: unregistrations</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code callable.registry.entries.active}: active registrations across all keys</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code callable.registry.target.duration.ms}: target execution time</li>
 * </ul>
 *
 * <p>The {@code callable.registry} prefix is configurable, so several registries can
 * share one {@link MeterRegistry}.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_NAME_PREFIX = "callable.registry";

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final MeterRegistry registry;
    private final Counter dispatchSuccess;
    private final Counter dispatchFailure;
    private final Counter noMatch;
    private final Counter ambiguous;
    private final Counter unknownKey;
    private final Counter registered;
    private final Counter overridden;
    private final Counter unregistered;
    private final Gauge activeEntriesGauge;
    private final DistributionSummary targetDuration;

    private final AtomicInteger activeEntries = new AtomicInteger();
    private volatile boolean closed;

    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_NAME_PREFIX);
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "pricing.rules"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
                .description("Dispatches whose target returned normally")
                .register(registry);
        this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
                .description("Dispatches whose target threw")
                .register(registry);
        this.noMatch = Counter.builder(namePrefix + ".dispatch.no_match")
                .description("Dispatches no registration accepted")
                .register(registry);
        this.ambiguous = Counter.builder(namePrefix + ".dispatch.ambiguous")
                .description("Dispatches rejected because registrations tied")
                .register(registry);
        this.unknownKey = Counter.builder(namePrefix + ".dispatch.unknown_key")
                .description("Dispatches of keys never registered")
                .register(registry);
        this.registered = Counter.builder(namePrefix + ".registration.added")
                .description("Successful registrations")
                .register(registry);
        this.overridden = Counter.builder(namePrefix + ".registration.overridden")
                .description("Registrations that retired an identical signature")
                .register(registry);
        this.unregistered = Counter.builder(namePrefix + ".registration.removed")
                .description("Registrations removed through their handle")
                .register(registry);

        this.activeEntriesGauge = Gauge.builder(namePrefix + ".entries.active", activeEntries, AtomicInteger::get)
                .description("Active registrations across all keys")
                .register(registry);

        this.targetDuration = DistributionSummary.builder(namePrefix + ".target.duration.ms")
                .description("Target execution time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementDispatchSuccess() {
        if (closed) return;
        dispatchSuccess.increment();
    }

    @Override
    public void incrementDispatchFailure() {
        if (closed) return;
        dispatchFailure.increment();
    }

    @Override
    public void incrementNoMatch() {
        if (closed) return;
        noMatch.increment();
    }

    @Override
    public void incrementAmbiguous() {
        if (closed) return;
        ambiguous.increment();
    }

    @Override
    public void incrementUnknownKey() {
        if (closed) return;
        unknownKey.increment();
    }

    @Override
    public void incrementRegistered() {
        if (closed) return;
        registered.increment();
    }

    @Override
    public void incrementOverridden() {
        if (closed) return;
        overridden.increment();
    }

    @Override
    public void incrementUnregistered() {
        if (closed) return;
        unregistered.increment();
    }

    @Override
    public void recordActiveEntries(int activeEntries) {
        if (closed) return;
        this.activeEntries.set(activeEntries);
    }

    @Override
    public void recordTargetDurationNanos(long durationNanos) {
        if (closed) return;
        targetDuration.record(durationNanos / NANOS_PER_MILLI);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     * Later calls on this exporter are ignored.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(dispatchSuccess, dispatchFailure, noMatch, ambiguous, unknownKey,
                registered, overridden, unregistered, activeEntriesGauge, targetDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
