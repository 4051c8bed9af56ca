package sentry.envelope;

import sentry.model.EventId;

/**
 * First line of an envelope. Every component is optional.
 *
 * @param eventId id of the event carried by the envelope, if it carries exactly one
 * @param dsn     connection descriptor the envelope is addressed to
 * @param sdk     producing SDK
 */
public record EnvelopeHeader(EventId eventId, String dsn, SdkInfo sdk) {
}
