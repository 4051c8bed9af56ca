package sentry.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sentry.filter.EventFilter;
import sentry.model.Event;
import sentry.ratelimit.RateLimiter;
import sentry.transport.Dsn;
import sentry.transport.IngestClient;
import sentry.transport.StubTransport;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlushSchedulerTest {

  private final StubTransport transport = new StubTransport();
  private EventDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    RateLimiter rateLimiter = new RateLimiter();
    dispatcher = EventDispatcher.builder()
        .ingestClient(new IngestClient(Dsn.parse("https://key@ingest.example.com/42"), transport, rateLimiter,
            "test-sdk/1.0"))
        .filter(new EventFilter(1.0, null))
        .rateLimiter(rateLimiter)
        .build();
  }

  @AfterEach
  void tearDown() {
    dispatcher.close();
  }

  @Test
  void periodicFlushDeliversQueuedEvents() throws Exception {
    dispatcher.capture(Event.ofMessage("x"), List.of());

    try (FlushScheduler scheduler = new FlushScheduler(dispatcher, Duration.ofMillis(10))) {
      scheduler.start();
      assertTrue(scheduler.isStarted());
      assertTrue(transport.awaitFirstSend(5000));
    }
  }

  @Test
  void tickFlushesOnCallingThread() {
    FlushScheduler scheduler = new FlushScheduler(dispatcher, Duration.ofSeconds(60));
    dispatcher.capture(Event.ofMessage("x"), List.of());

    scheduler.tick();

    assertEquals(1, transport.requests.size());
    assertFalse(scheduler.isStarted());
  }

  @Test
  void closedSchedulerCannotRestart() {
    FlushScheduler scheduler = new FlushScheduler(dispatcher, Duration.ofSeconds(1));
    scheduler.close();

    assertThrows(IllegalStateException.class, scheduler::start);
    scheduler.tick();
    assertTrue(transport.requests.isEmpty());
  }

  @Test
  void nonPositiveIntervalRejected() {
    assertThrows(IllegalArgumentException.class, () -> new FlushScheduler(dispatcher, Duration.ZERO));
  }
}
