package sentry.envelope;

import java.util.List;
import java.util.Objects;

/**
 * Multi-part container sent to the envelope endpoint. Item order is preserved on the wire.
 *
 * @see EnvelopeCodec
 */
public record Envelope(EnvelopeHeader header, List<EnvelopeItem> items) {
  public Envelope {
    Objects.requireNonNull(header, "header");
    items = items == null ? List.of() : List.copyOf(items);
  }
}
