package sentry.envelope;

import java.util.Arrays;
import java.util.Objects;

/**
 * One envelope item: a header and a raw payload that need not be JSON.
 */
public final class EnvelopeItem {
  private final EnvelopeItemHeader header;
  private final byte[] payload;

  public EnvelopeItem(EnvelopeItemHeader header, byte[] payload) {
    this.header = Objects.requireNonNull(header, "header");
    Objects.requireNonNull(payload, "payload");
    this.payload = Arrays.copyOf(payload, payload.length);
  }

  public EnvelopeItemHeader header() {
    return header;
  }

  public byte[] payload() {
    return Arrays.copyOf(payload, payload.length);
  }

  public int length() {
    return payload.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EnvelopeItem other)) return false;
    return header.equals(other.header) && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return 31 * header.hashCode() + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "EnvelopeItem{type=" + header.type() + ", length=" + payload.length + "}";
  }
}
