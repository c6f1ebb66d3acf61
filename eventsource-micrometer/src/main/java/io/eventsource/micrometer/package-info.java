/**
 * Micrometer bridge for exporting event store and projection metrics to Prometheus, Grafana,
 * and other backends.
 *
 * <p>{@link io.eventsource.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.eventsource.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package io.eventsource.micrometer;
