/**
 * Micrometer bridge for {@link io.eventwatch.spi.MetricsExporter}.
 */
package io.eventwatch.micrometer;
