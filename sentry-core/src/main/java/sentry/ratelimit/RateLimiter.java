package sentry.ratelimit;

import sentry.transport.TransportResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global send suppression window driven by HTTP 429 responses.
 *
 * <p>A lookup never blocks: callers that find sends suppressed skip the attempt. The latest
 * server signal always replaces the stored window, so a shorter {@code Retry-After} can
 * end an earlier, longer block. Responses other than 429 leave the window untouched.
 *
 * <p>This class is thread-safe.
 */
public final class RateLimiter {
  private static final Logger logger = Logger.getLogger(RateLimiter.class.getName());

  public static final int TOO_MANY_REQUESTS = 429;
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

  private final Clock clock;
  private Instant blockedUntil;

  public RateLimiter() {
    this(Clock.systemUTC());
  }

  public RateLimiter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public boolean isBlocked() {
    return isBlocked(clock.instant());
  }

  /**
   * Returns whether sends are suppressed at {@code now}.
   *
   * @param now the instant to test
   * @return {@code true} while {@code now} is before the stored window end
   */
  public synchronized boolean isBlocked(Instant now) {
    return blockedUntil != null && blockedUntil.isAfter(now);
  }

  public synchronized void block(Instant until) {
    this.blockedUntil = Objects.requireNonNull(until, "until");
  }

  public synchronized Instant blockedUntil() {
    return blockedUntil;
  }

  /**
   * Updates the window from an ingestion response. Only status 429 has an effect: a numeric
   * {@code Retry-After} header blocks for that many seconds, anything else for
   * {@link #DEFAULT_WINDOW}.
   *
   * @param response the response to inspect
   * @return {@code true} if the response was a rate-limit signal
   */
  public boolean update(TransportResponse response) {
    if (response.status() != TOO_MANY_REQUESTS) {
      return false;
    }
    Instant now = clock.instant();
    Duration window = parseRetryAfter(response.header("Retry-After"));
    Instant until = now.plus(window);
    block(until);
    logger.log(Level.WARNING, "Rate limited by ingestion service until " + until);
    return true;
  }

  static Duration parseRetryAfter(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_WINDOW;
    }
    try {
      double seconds = Double.parseDouble(value.trim());
      if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
        return DEFAULT_WINDOW;
      }
      return Duration.ofMillis((long) (seconds * 1000));
    } catch (NumberFormatException e) {
      return DEFAULT_WINDOW;
    }
  }
}
