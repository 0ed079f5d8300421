package io.callregistry.spi;

/**
 * Observability hook for exporting registry counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of dispatches whose target returned normally.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of dispatches whose target threw.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of dispatches rejected because no signature applied.
     */
    void incrementNoMatch();

    /**
     * Increments the count of dispatches rejected because of a specificity tie.
     */
    void incrementAmbiguous();

    /**
     * Increments the count of dispatches against a key without registration history.
     */
    default void incrementUnknownKey() {
    }

    /**
     * Increments the count of successful registrations.
     */
    default void incrementRegistered() {
    }

    /**
     * Increments the count of entries retired by an overriding registration.
     */
    default void incrementOverridden() {
    }

    /**
     * Increments the count of entries removed through their handle.
     */
    default void incrementUnregistered() {
    }

    /**
     * Records the number of active entries after a registration change.
     *
     * @param activeEntries entries across all keys (always non-negative)
     */
    default void recordActiveEntries(int activeEntries) {
    }

    /**
     * Records the time spent executing the selected target only.
     *
     * @param durationNanos execution time in nanoseconds (always non-negative)
     */
    default void recordTargetDurationNanos(long durationNanos) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementNoMatch() {
        }

        @Override
        public void incrementAmbiguous() {
        }
    }
}
