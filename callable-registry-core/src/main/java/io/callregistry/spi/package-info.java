/**
 * Service provider interfaces implemented by optional modules.
 *
 * @see io.callregistry.spi.MetricsExporter
 */
package io.callregistry.spi;
