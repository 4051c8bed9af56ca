package sentry.model;

import java.time.Instant;

/**
 * Contextual note recorded before an event.
 */
public record Breadcrumb(String message, Level level, Instant timestamp) {

  public static Breadcrumb of(String message) {
    return new Breadcrumb(message, null, Instant.now());
  }
}
