package sentry.model;

import java.util.Locale;

/**
 * Event severity. The wire value is the lower-case constant name.
 */
public enum Level {
  FATAL,
  ERROR,
  WARNING,
  INFO,
  DEBUG;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
