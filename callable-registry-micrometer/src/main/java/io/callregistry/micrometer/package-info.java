/**
 * Micrometer bridge for exporting dispatch and registration metrics.
 *
 * <p>{@link io.callregistry.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.callregistry.spi.MetricsExporter} SPI with Micrometer counters, a gauge
 * and a distribution summary.
 */
package io.callregistry.micrometer;
