package sentry.model;

import java.util.Objects;
import java.util.UUID;

/**
 * 128-bit event identifier.
 *
 * <p>On the wire an id is always 32 lowercase hexadecimal characters without dashes
 * (e.g. {@code ecce513737d441b78b66c84ace35a281}). {@link #toUuid()} and {@link #fromUuid(UUID)}
 * convert to and from the canonical dashed form.
 */
public final class EventId {
  private static final int HEX_LENGTH = 32;

  private final UUID uuid;

  private EventId(UUID uuid) {
    this.uuid = uuid;
  }

  public static EventId random() {
    return new EventId(UUID.randomUUID());
  }

  public static EventId fromUuid(UUID uuid) {
    return new EventId(Objects.requireNonNull(uuid, "uuid"));
  }

  /**
   * Parses a 32-character hexadecimal id. Upper-case digits are accepted.
   *
   * @param hex the encoded id
   * @return the parsed id
   * @throws IllegalArgumentException if {@code hex} is not exactly 32 hex digits
   */
  public static EventId fromHex(String hex) {
    Objects.requireNonNull(hex, "hex");
    if (hex.length() != HEX_LENGTH) {
      throw new IllegalArgumentException("Expected " + HEX_LENGTH + " hex characters, got " + hex.length());
    }
    for (int i = 0; i < HEX_LENGTH; i++) {
      if (Character.digit(hex.charAt(i), 16) < 0) {
        throw new IllegalArgumentException("Invalid hex character at index " + i + ": " + hex);
      }
    }
    long most = Long.parseUnsignedLong(hex.substring(0, 16), 16);
    long least = Long.parseUnsignedLong(hex.substring(16), 16);
    return new EventId(new UUID(most, least));
  }

  public UUID toUuid() {
    return uuid;
  }

  public String toHex() {
    return toHex(uuid.getMostSignificantBits()) + toHex(uuid.getLeastSignificantBits());
  }

  private static String toHex(long bits) {
    String digits = Long.toHexString(bits);
    if (digits.length() == 16) {
      return digits;
    }
    return "0".repeat(16 - digits.length()) + digits;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EventId other)) return false;
    return uuid.equals(other.uuid);
  }

  @Override
  public int hashCode() {
    return uuid.hashCode();
  }

  @Override
  public String toString() {
    return toHex();
  }
}
