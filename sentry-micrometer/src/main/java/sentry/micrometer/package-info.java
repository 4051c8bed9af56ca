/**
 * Micrometer bridge for the client's delivery metrics.
 *
 * @see sentry.micrometer.MicrometerMetricsExporter
 */
package sentry.micrometer;
