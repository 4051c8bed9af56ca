/**
 * HTTP delivery to the ingestion endpoints resolved from a {@link sentry.transport.Dsn}.
 */
package sentry.transport;
