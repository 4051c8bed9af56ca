package sentry.model;

import java.util.Objects;

/**
 * The user who triggered an event.
 */
public record User(String id, String ipAddress) {
  public User {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ipAddress, "ipAddress");
  }
}
