/**
 * Envelope wire format: a JSON header line followed by items, each a JSON header line and a
 * length-prefixed payload.
 *
 * <p>{@link sentry.envelope.EventSerializer} turns events into {@code event} items and
 * {@link sentry.envelope.EnvelopeCodec} encodes and decodes whole envelopes.
 */
package sentry.envelope;
