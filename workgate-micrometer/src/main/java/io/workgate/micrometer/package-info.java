/**
 * Micrometer integration: {@link io.workgate.micrometer.MicrometerMetricsExporter}.
 */
package io.workgate.micrometer;
