/**
 * Service Provider Interfaces (SPI) for extending the client.
 *
 * @see sentry.spi.MetricsExporter
 * @see sentry.transport.Transport
 */
package sentry.spi;
