package sentry.envelope;

import java.util.Objects;

/**
 * Header preceding each envelope payload.
 *
 * @param type        item type tag, e.g. {@value #TYPE_EVENT} or {@value #TYPE_ATTACHMENT}
 * @param filename    attachment file name, or {@code null}
 * @param contentType MIME type of the payload, or {@code null}
 */
public record EnvelopeItemHeader(String type, String filename, String contentType) {
  public static final String TYPE_EVENT = "event";
  public static final String TYPE_ATTACHMENT = "attachment";

  public EnvelopeItemHeader {
    Objects.requireNonNull(type, "type");
    if (type.isEmpty()) {
      throw new IllegalArgumentException("type cannot be empty");
    }
  }

  public static EnvelopeItemHeader event() {
    return new EnvelopeItemHeader(TYPE_EVENT, null, "application/json");
  }
}
