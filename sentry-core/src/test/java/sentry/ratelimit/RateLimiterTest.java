package sentry.ratelimit;

import org.junit.jupiter.api.Test;
import sentry.transport.TransportResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  private final RateLimiter limiter = new RateLimiter(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void notBlockedBeforeAnySignal() {
    assertFalse(limiter.isBlocked());
    assertNull(limiter.blockedUntil());
  }

  @Test
  void blockedStrictlyBeforeWindowEnd() {
    Instant until = NOW.plusSeconds(30);
    limiter.block(until);

    assertTrue(limiter.isBlocked(NOW));
    assertTrue(limiter.isBlocked(until.minusMillis(1)));
    assertFalse(limiter.isBlocked(until));
    assertFalse(limiter.isBlocked(until.plusSeconds(1)));
  }

  @Test
  void retryAfterSecondsSetsWindow() {
    assertTrue(limiter.update(response(429, "120")));

    assertEquals(NOW.plusSeconds(120), limiter.blockedUntil());
    assertTrue(limiter.isBlocked());
  }

  @Test
  void missingRetryAfterUsesDefaultWindow() {
    limiter.update(response(429, null));

    assertEquals(NOW.plus(RateLimiter.DEFAULT_WINDOW), limiter.blockedUntil());
  }

  @Test
  void nonNumericRetryAfterUsesDefaultWindow() {
    limiter.update(response(429, "Wed, 21 Oct 2015 07:28:00 GMT"));

    assertEquals(NOW.plusSeconds(60), limiter.blockedUntil());
  }

  @Test
  void otherStatusesNeverClearBlock() {
    limiter.block(NOW.plusSeconds(30));

    assertFalse(limiter.update(response(200, null)));
    assertFalse(limiter.update(response(503, "10")));

    assertEquals(NOW.plusSeconds(30), limiter.blockedUntil());
  }

  @Test
  void latestSignalOverwritesLongerWindow() {
    limiter.block(NOW.plusSeconds(120));

    limiter.update(response(429, "10"));

    assertEquals(NOW.plusSeconds(10), limiter.blockedUntil());
  }

  @Test
  void retryAfterAcceptsFractionalSeconds() {
    assertEquals(Duration.ofMillis(1500), RateLimiter.parseRetryAfter("1.5"));
    assertEquals(RateLimiter.DEFAULT_WINDOW, RateLimiter.parseRetryAfter(" "));
  }

  private static TransportResponse response(int status, String retryAfter) {
    Map<String, List<String>> headers = retryAfter == null
        ? Map.of() : Map.of("retry-after", List.of(retryAfter));
    return new TransportResponse(status, headers, new byte[0]);
  }
}
